package com.execrisk.infra.kafka.topics;

/**
 * Topics this service publishes to. A name is at least two lowercase segments followed by a
 * version segment, e.g. {@code risk.alerts.v1}; consumers pin to the version.
 */
public final class TopicNames {
  public static final String RISK_ALERTS_V1 = "risk.alerts.v1";
  public static final String ORDERS_EXECUTION_V1 = "orders.execution.v1";

  private TopicNames() {}

  public static String requireVersioned(String topic) {
    String problem = problemWith(topic);
    if (problem != null) {
      throw new IllegalArgumentException("Invalid topic name " + topic + ": " + problem);
    }
    return topic;
  }

  public static boolean isVersioned(String topic) {
    return problemWith(topic) == null;
  }

  private static String problemWith(String topic) {
    if (topic == null || topic.isEmpty()) {
      return "missing";
    }
    String[] segments = topic.split("\\.", -1);
    if (segments.length < 3) {
      return "expected <domain>.<name>.v<N>";
    }
    for (int i = 0; i < segments.length - 1; i++) {
      if (!isLowercaseSegment(segments[i])) {
        return "segment '" + segments[i] + "' must be lowercase alphanumeric";
      }
    }
    String version = segments[segments.length - 1];
    if (version.length() < 2 || version.charAt(0) != 'v' || version.charAt(1) == '0') {
      return "last segment must be v1 or later";
    }
    for (int i = 1; i < version.length(); i++) {
      if (!Character.isDigit(version.charAt(i))) {
        return "last segment must be v1 or later";
      }
    }
    return null;
  }

  private static boolean isLowercaseSegment(String segment) {
    if (segment.isEmpty() || segment.charAt(0) < 'a' || segment.charAt(0) > 'z') {
      return false;
    }
    for (int i = 1; i < segment.length(); i++) {
      char c = segment.charAt(i);
      if (!(c >= 'a' && c <= 'z') && !(c >= '0' && c <= '9')) {
        return false;
      }
    }
    return true;
  }
}
