package com.execrisk.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record OrderIntent(
    UUID id,
    String instrument,
    OrderSide side,
    BigDecimal qty,
    PacingAlgorithm algorithm,
    PacingParameters pacing,
    BigDecimal limitPrice,
    Instant createdAt) {
  public static final String QTY_NOT_POSITIVE = "QTY_NOT_POSITIVE";
  public static final String QTY_LOT_MISMATCH = "QTY_LOT_MISMATCH";

  public OrderIntent {
    Objects.requireNonNull(id, "id must not be null");
    if (instrument == null || instrument.isBlank()) {
      throw new OrderDomainException("instrument must not be blank");
    }
    Objects.requireNonNull(side, "side must not be null");
    if (qty == null || qty.signum() <= 0) {
      throw new OrderDomainException(QTY_NOT_POSITIVE, "qty must be > 0");
    }
    Objects.requireNonNull(algorithm, "algorithm must not be null");
    pacing = pacing == null ? PacingParameters.none() : pacing;
    if (limitPrice != null && limitPrice.signum() <= 0) {
      throw new OrderDomainException("limitPrice must be > 0 when present");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public static OrderIntent create(
      String instrument,
      OrderSide side,
      BigDecimal qty,
      PacingAlgorithm algorithm,
      PacingParameters pacing,
      Instant now) {
    return new OrderIntent(UUID.randomUUID(), instrument, side, qty, algorithm, pacing, null, now);
  }

  public BigDecimal signedQty() {
    return side.signed(qty);
  }
}
