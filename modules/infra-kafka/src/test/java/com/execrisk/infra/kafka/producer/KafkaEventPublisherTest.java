package com.execrisk.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import com.execrisk.infra.kafka.contract.EventHeaders;
import com.execrisk.infra.kafka.contract.EventType;
import com.execrisk.infra.kafka.contract.payload.RiskAlertRaisedV1;
import com.execrisk.infra.kafka.observability.NoOpKafkaTelemetry;
import com.execrisk.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.execrisk.infra.kafka.serde.EventObjectMapperFactory;
import com.execrisk.infra.kafka.topics.TopicNames;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private static final Instant RAISED_AT = Instant.parse("2026-02-24T12:00:00Z");

  @Test
  void shouldPublishWithRequiredHeadersAndKey() throws Exception {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher = publisher(kafkaTemplate);

    ProducerRecord<String, String> sent =
        new ProducerRecord<>(TopicNames.RISK_ALERTS_V1, "MAX_DRAWDOWN", "{}");
    CompletableFuture<SendResult<String, String>> sendFuture =
        CompletableFuture.completedFuture(new SendResult<>(sent, null));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(sendFuture);

    EventEnvelope<RiskAlertRaisedV1> envelope = envelope();
    publisher.publish(TopicNames.RISK_ALERTS_V1, envelope).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> actual = captor.getValue();

    assertEquals(TopicNames.RISK_ALERTS_V1, actual.topic());
    assertEquals("MAX_DRAWDOWN", actual.key());
    assertNotNull(actual.value());
    assertEquals(
        EventType.RISK_ALERT_RAISED.wireName(),
        headerValue(actual, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(actual, EventHeaders.X_EVENT_VERSION));
    assertEquals("alert-1", headerValue(actual, EventHeaders.X_CORRELATION_ID));
    assertEquals("execution-service", headerValue(actual, EventHeaders.X_PRODUCER));
    assertEquals(envelope.eventId().toString(), headerValue(actual, EventHeaders.X_EVENT_ID));
    assertEquals(EventHeaders.APPLICATION_JSON, headerValue(actual, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldWrapPublishFailureWithKafkaPublishException() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher = publisher(kafkaTemplate);

    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failed);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(TopicNames.RISK_ALERTS_V1, envelope()).get());
    KafkaPublishException cause = (KafkaPublishException) ex.getCause();
    assertEquals(TopicNames.RISK_ALERTS_V1, cause.topic());
    assertEquals(EventType.RISK_ALERT_RAISED.wireName(), cause.eventType());
    assertEquals("MAX_DRAWDOWN", cause.key());
  }

  @Test
  void shouldRejectInvalidTopicBeforeSending() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher = publisher(kafkaTemplate);

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("RiskAlerts", envelope()));
    verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
  }

  private static KafkaEventPublisher publisher(KafkaTemplate<String, String> kafkaTemplate) {
    return new KafkaEventPublisher(
        kafkaTemplate,
        new EventEnvelopeJsonCodec(EventObjectMapperFactory.create()),
        new NoOpKafkaTelemetry(),
        Duration.ZERO);
  }

  private static EventEnvelope<RiskAlertRaisedV1> envelope() {
    return EventEnvelope.of(
        EventType.RISK_ALERT_RAISED,
        "execution-service",
        "alert-1",
        "MAX_DRAWDOWN",
        RAISED_AT,
        new RiskAlertRaisedV1("alert-1", "CRITICAL", "MAX_DRAWDOWN", "drawdown 12%", RAISED_AT));
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
