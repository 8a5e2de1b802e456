package com.execrisk.integration.venue;

public record VenueCancelResult(boolean acknowledged, String error) {
  public static VenueCancelResult ack() {
    return new VenueCancelResult(true, null);
  }

  public static VenueCancelResult error(String error) {
    return new VenueCancelResult(false, error == null ? "UNSPECIFIED" : error);
  }
}
