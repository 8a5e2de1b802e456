package com.execrisk.infra.kafka.producer;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import com.execrisk.infra.kafka.contract.EventHeaders;
import com.execrisk.infra.kafka.observability.KafkaTelemetry;
import com.execrisk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.execrisk.infra.kafka.topics.TopicNames;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, EventEnvelope<T> envelope) {
    TopicNames.requireVersioned(topic);
    Objects.requireNonNull(envelope, "envelope must not be null");
    ProducerRecord<String, String> record = toRecord(topic, codec.encode(envelope), envelope);

    long started = System.nanoTime();
    CompletableFuture<SendResult<String, String>> sent = kafkaTemplate.send(record);
    if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
      sent = sent.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    return sent.handle(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, envelope.eventType(), System.nanoTime() - started);
            return sendResult;
          }
          KafkaPublishException failure = wrap(topic, envelope, throwable);
          telemetry.onPublishFailure(topic, envelope.eventType(), failure);
          log.warn(
              "Event publish failed topic={} key={} eventType={} eventId={} error={}",
              topic,
              envelope.key(),
              envelope.eventType(),
              envelope.eventId(),
              String.valueOf(failure.getCause()));
          throw failure;
        });
  }

  static ProducerRecord<String, String> toRecord(
      String topic, String value, EventEnvelope<?> envelope) {
    ProducerRecord<String, String> record = new ProducerRecord<>(topic, envelope.key(), value);
    for (Map.Entry<String, String> header : EventHeaders.forEnvelope(envelope).entrySet()) {
      record.headers().add(header.getKey(), header.getValue().getBytes(StandardCharsets.UTF_8));
    }
    return record;
  }

  private static KafkaPublishException wrap(
      String topic, EventEnvelope<?> envelope, Throwable throwable) {
    Throwable cause = throwable;
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      cause = throwable.getCause();
    }
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    String outcome = cause instanceof TimeoutException ? "timed out" : "failed";
    return new KafkaPublishException(
        topic,
        envelope.key(),
        envelope.eventType(),
        "Event publish "
            + outcome
            + " topic="
            + topic
            + " key="
            + envelope.key()
            + " eventType="
            + envelope.eventType(),
        cause);
  }
}
