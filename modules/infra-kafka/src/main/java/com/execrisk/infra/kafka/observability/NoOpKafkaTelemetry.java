package com.execrisk.infra.kafka.observability;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {}

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {}
}
