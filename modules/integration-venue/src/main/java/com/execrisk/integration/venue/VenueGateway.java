package com.execrisk.integration.venue;

public interface VenueGateway {
  /**
   * Sends one order to the venue. Transient failures surface as {@link VenueTransientException};
   * a definitive refusal comes back as {@link VenueSubmitResult.Rejected}.
   */
  VenueSubmitResult submit(VenueOrderRequest request);

  VenueCancelResult cancel(String venueOrderId);

  void registerFillListener(VenueFillListener listener);
}
