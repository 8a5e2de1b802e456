package com.execrisk.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.execrisk.infra.kafka.contract.EventType;
import org.junit.jupiter.api.Test;

class TopicNamesTest {
  @Test
  void shouldAcceptEveryEventTopic() {
    for (EventType type : EventType.values()) {
      assertTrue(TopicNames.isVersioned(type.topic()), type.name());
    }
  }

  @Test
  void shouldRejectUnversionedOrMalformedNames() {
    assertFalse(TopicNames.isVersioned("risk.alerts"));
    assertFalse(TopicNames.isVersioned("Risk.Alerts.v1"));
    assertFalse(TopicNames.isVersioned("alerts.v1"));
    assertFalse(TopicNames.isVersioned("risk.alerts.v0"));
    assertFalse(TopicNames.isVersioned("risk..alerts.v1"));
    assertFalse(TopicNames.isVersioned("risk.alerts.v1x"));
    assertFalse(TopicNames.isVersioned(null));
  }

  @Test
  void shouldNameOffendingSegmentInError() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> TopicNames.requireVersioned("risk.Alerts.v1"));

    assertEquals(
        "Invalid topic name risk.Alerts.v1: segment 'Alerts' must be lowercase alphanumeric",
        ex.getMessage());
  }
}
