package com.execrisk.infra.kafka.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Wire wrapper for every event on the feed. {@code key} is the partition key: the rule id for
 * alerts, the parent order id for execution events.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope<T>(
    UUID eventId,
    String eventType,
    int eventVersion,
    Instant occurredAt,
    String producer,
    String correlationId,
    String key,
    T payload) {

  public EventEnvelope {
    Objects.requireNonNull(eventId, "eventId must not be null");
    requireNonBlank(eventType, "eventType");
    if (eventVersion < 1) {
      throw new IllegalArgumentException("eventVersion must be >= 1");
    }
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    requireNonBlank(producer, "producer");
    requireNonBlank(correlationId, "correlationId");
    requireNonBlank(key, "key");
    Objects.requireNonNull(payload, "payload must not be null");
  }

  public static <T> EventEnvelope<T> of(
      EventType type,
      String producer,
      String correlationId,
      String key,
      Instant occurredAt,
      T payload) {
    Objects.requireNonNull(type, "type must not be null");
    return new EventEnvelope<>(
        UUID.randomUUID(),
        type.wireName(),
        type.version(),
        occurredAt,
        producer,
        correlationId,
        key,
        payload);
  }

  public boolean isOf(EventType type) {
    return type.wireName().equals(eventType) && type.version() == eventVersion;
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(fieldName + " must not be blank");
    }
  }
}
