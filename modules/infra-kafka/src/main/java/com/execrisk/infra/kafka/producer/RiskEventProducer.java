package com.execrisk.infra.kafka.producer;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import com.execrisk.infra.kafka.contract.EventType;
import com.execrisk.infra.kafka.contract.payload.RiskAlertRaisedV1;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class RiskEventProducer {
  private final EventPublisher eventPublisher;
  private final String producerName;

  public RiskEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  /** Keyed by rule id so every alert for one rule lands on the same partition in order. */
  public CompletableFuture<SendResult<String, String>> publishAlertRaised(
      RiskAlertRaisedV1 payload) {
    EventType type = EventType.RISK_ALERT_RAISED;
    EventEnvelope<RiskAlertRaisedV1> envelope =
        EventEnvelope.of(
            type,
            producerName,
            ProducerKeys.require(payload.alertId(), "payload.alertId"),
            ProducerKeys.require(payload.ruleId(), "payload.ruleId"),
            payload.raisedAt(),
            payload);
    return eventPublisher.publish(type.topic(), envelope);
  }
}
