package com.execrisk.integration.venue;

public class VenueTransientException extends RuntimeException {
  public enum Reason {
    TIMEOUT,
    RATE_LIMITED,
    CONNECTIVITY
  }

  private final Reason reason;

  public VenueTransientException(Reason reason, String message) {
    this(reason, message, null);
  }

  public VenueTransientException(Reason reason, String message, Throwable cause) {
    super("Venue transient failure reason=" + reason + ": " + message, cause);
    this.reason = reason == null ? Reason.CONNECTIVITY : reason;
  }

  public Reason reason() {
    return reason;
  }
}
