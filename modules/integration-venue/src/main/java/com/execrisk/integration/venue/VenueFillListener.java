package com.execrisk.integration.venue;

public interface VenueFillListener {
  void onFill(VenueFillNotification notification);

  default void onCanceled(String venueOrderId, String reason) {}

  static VenueFillListener noop() {
    return notification -> {};
  }
}
