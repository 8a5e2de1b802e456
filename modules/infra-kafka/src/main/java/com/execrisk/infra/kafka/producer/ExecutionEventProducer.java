package com.execrisk.infra.kafka.producer;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import com.execrisk.infra.kafka.contract.EventType;
import com.execrisk.infra.kafka.contract.payload.ParentOrderCompletedV1;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class ExecutionEventProducer {
  private final EventPublisher eventPublisher;
  private final String producerName;

  public ExecutionEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  /** One terminal event per parent order, keyed and correlated by the parent id. */
  public CompletableFuture<SendResult<String, String>> publishParentOrderCompleted(
      ParentOrderCompletedV1 payload) {
    EventType type = EventType.PARENT_ORDER_COMPLETED;
    String orderId = ProducerKeys.require(payload.orderId(), "payload.orderId");
    EventEnvelope<ParentOrderCompletedV1> envelope =
        EventEnvelope.of(type, producerName, orderId, orderId, payload.completedAt(), payload);
    return eventPublisher.publish(type.topic(), envelope);
  }
}
