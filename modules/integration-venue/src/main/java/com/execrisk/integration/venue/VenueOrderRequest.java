package com.execrisk.integration.venue;

import com.execrisk.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.util.Objects;

public record VenueOrderRequest(
    String clientOrderId,
    String instrument,
    OrderSide side,
    BigDecimal qty,
    BigDecimal limitPrice) {

  public VenueOrderRequest {
    if (clientOrderId == null || clientOrderId.isBlank()) {
      throw new IllegalArgumentException("clientOrderId must not be blank");
    }
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(qty, "qty must not be null");
    if (qty.signum() <= 0) {
      throw new IllegalArgumentException("qty must be > 0");
    }
  }

  public boolean isMarket() {
    return limitPrice == null;
  }
}
