package com.execrisk.integration.venue;

public sealed interface VenueSubmitResult {
  static VenueSubmitResult accepted(String venueOrderId) {
    return new Accepted(venueOrderId);
  }

  static VenueSubmitResult rejected(String reason) {
    return new Rejected(reason);
  }

  record Accepted(String venueOrderId) implements VenueSubmitResult {
    public Accepted {
      if (venueOrderId == null || venueOrderId.isBlank()) {
        throw new IllegalArgumentException("venueOrderId must not be blank");
      }
    }
  }

  record Rejected(String reason) implements VenueSubmitResult {
    public Rejected {
      reason = reason == null || reason.isBlank() ? "UNSPECIFIED" : reason;
    }
  }
}
