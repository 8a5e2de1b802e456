package com.execrisk.service.events;

import com.execrisk.domain.risk.Alert;
import com.execrisk.engine.monitor.AlertSubscriber;
import com.execrisk.infra.kafka.contract.payload.RiskAlertRaisedV1;
import com.execrisk.infra.kafka.producer.RiskEventProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaAlertForwarder implements AlertSubscriber {
  private static final Logger log = LoggerFactory.getLogger(KafkaAlertForwarder.class);

  private final RiskEventProducer producer;

  public KafkaAlertForwarder(RiskEventProducer producer) {
    this.producer = producer;
  }

  @Override
  public void onAlert(Alert alert) {
    producer
        .publishAlertRaised(toPayload(alert))
        .whenComplete(
            (result, error) -> {
              if (error != null) {
                log.warn(
                    "Alert publish failed alertId={} rule={} error={}",
                    alert.id(),
                    alert.ruleId(),
                    error.getMessage());
              }
            });
  }

  static RiskAlertRaisedV1 toPayload(Alert alert) {
    return new RiskAlertRaisedV1(
        alert.id().toString(),
        alert.severity().name(),
        alert.ruleId().name(),
        alert.message(),
        alert.raisedAt());
  }
}
