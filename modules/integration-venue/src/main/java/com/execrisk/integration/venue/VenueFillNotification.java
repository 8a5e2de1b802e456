package com.execrisk.integration.venue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record VenueFillNotification(
    String venueOrderId,
    String tradeId,
    BigDecimal qty,
    BigDecimal price,
    BigDecimal fee,
    Instant executedAt) {

  public VenueFillNotification {
    if (venueOrderId == null || venueOrderId.isBlank()) {
      throw new IllegalArgumentException("venueOrderId must not be blank");
    }
    if (tradeId == null || tradeId.isBlank()) {
      throw new IllegalArgumentException("tradeId must not be blank");
    }
    Objects.requireNonNull(qty, "qty must not be null");
    Objects.requireNonNull(price, "price must not be null");
    fee = fee == null ? BigDecimal.ZERO : fee;
    Objects.requireNonNull(executedAt, "executedAt must not be null");
  }
}
