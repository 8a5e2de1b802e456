package com.execrisk.integration.venue;

public class VenueRetryExhaustedException extends RuntimeException {
  private final int attempts;

  public VenueRetryExhaustedException(int attempts, VenueTransientException lastFailure) {
    super("Venue submission failed after " + attempts + " attempts", lastFailure);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }

  public VenueTransientException lastFailure() {
    return (VenueTransientException) getCause();
  }
}
