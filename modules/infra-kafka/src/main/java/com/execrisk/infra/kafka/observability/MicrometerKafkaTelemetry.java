package com.execrisk.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

/** Counts published events per topic and outcome; times successful sends. */
public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  static final String EVENTS_PUBLISHED = "events.published";
  static final String PUBLISH_LATENCY = "events.publish.latency";

  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {
    published(topic, eventType, "success", "none").increment();
    Timer.builder(PUBLISH_LATENCY)
        .tag("topic", tagValue(topic))
        .tag("event_type", tagValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {
    Throwable cause = error != null && error.getCause() != null ? error.getCause() : error;
    String errorTag = cause == null ? "unknown" : cause.getClass().getSimpleName();
    published(topic, eventType, "failure", errorTag).increment();
  }

  private Counter published(String topic, String eventType, String outcome, String error) {
    return meterRegistry.counter(
        EVENTS_PUBLISHED,
        "topic",
        tagValue(topic),
        "event_type",
        tagValue(eventType),
        "outcome",
        outcome,
        "error",
        error);
  }

  private static String tagValue(String value) {
    return value == null || value.isBlank() ? "unknown" : value;
  }
}
