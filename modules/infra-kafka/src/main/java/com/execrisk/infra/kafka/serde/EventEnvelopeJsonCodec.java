package com.execrisk.infra.kafka.serde;

import com.execrisk.infra.kafka.contract.EventEnvelope;
import com.execrisk.infra.kafka.contract.EventType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

public class EventEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public EventEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Event envelope not serializable eventType=" + envelope.eventType(), ex);
    }
  }

  /** Reads an envelope and checks it carries the expected event type and version. */
  public <T> EventEnvelope<T> decode(String json, EventType expected, Class<T> payloadType) {
    JavaType envelopeType =
        objectMapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
    EventEnvelope<T> envelope;
    try {
      envelope = objectMapper.readValue(json, envelopeType);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Event envelope not readable expected=" + expected.wireName(), ex);
    }
    if (!envelope.isOf(expected)) {
      throw new IllegalStateException(
          "Unexpected event expected="
              + expected.wireName()
              + "/v"
              + expected.version()
              + " actual="
              + envelope.eventType()
              + "/v"
              + envelope.eventVersion());
    }
    return envelope;
  }
}
