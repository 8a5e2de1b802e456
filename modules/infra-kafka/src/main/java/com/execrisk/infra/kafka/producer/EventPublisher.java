package com.execrisk.infra.kafka.producer;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

/** Sends an envelope to {@code topic}, partitioned by the envelope key. */
public interface EventPublisher {
  <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, EventEnvelope<T> envelope);
}
