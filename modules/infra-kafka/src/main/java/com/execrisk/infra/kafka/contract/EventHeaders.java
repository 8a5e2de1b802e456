package com.execrisk.infra.kafka.contract;

import java.util.LinkedHashMap;
import java.util.Map;

public final class EventHeaders {
  public static final String X_EVENT_ID = "x-event-id";
  public static final String X_EVENT_TYPE = "x-event-type";
  public static final String X_EVENT_VERSION = "x-event-version";
  public static final String X_CORRELATION_ID = "x-correlation-id";
  public static final String X_PRODUCER = "x-producer";
  public static final String CONTENT_TYPE = "content-type";
  public static final String APPLICATION_JSON = "application/json";

  private EventHeaders() {}

  /** Record headers for an envelope, in the order they are written. */
  public static Map<String, String> forEnvelope(EventEnvelope<?> envelope) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(X_EVENT_ID, envelope.eventId().toString());
    headers.put(X_EVENT_TYPE, envelope.eventType());
    headers.put(X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    headers.put(X_CORRELATION_ID, envelope.correlationId());
    headers.put(X_PRODUCER, envelope.producer());
    headers.put(CONTENT_TYPE, APPLICATION_JSON);
    return headers;
  }
}
