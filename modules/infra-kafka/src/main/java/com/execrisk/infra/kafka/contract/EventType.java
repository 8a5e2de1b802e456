package com.execrisk.infra.kafka.contract;

import com.execrisk.infra.kafka.topics.TopicNames;
import java.util.Optional;

/** Event kinds on the feed, each bound to its wire name, schema version and topic. */
public enum EventType {
  RISK_ALERT_RAISED("RiskAlertRaised", 1, TopicNames.RISK_ALERTS_V1),
  PARENT_ORDER_COMPLETED("ParentOrderCompleted", 1, TopicNames.ORDERS_EXECUTION_V1);

  private final String wireName;
  private final int version;
  private final String topic;

  EventType(String wireName, int version, String topic) {
    this.wireName = wireName;
    this.version = version;
    this.topic = topic;
  }

  public String wireName() {
    return wireName;
  }

  public int version() {
    return version;
  }

  public String topic() {
    return topic;
  }

  public static Optional<EventType> fromWire(String wireName, int version) {
    for (EventType type : values()) {
      if (type.wireName.equals(wireName) && type.version == version) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
