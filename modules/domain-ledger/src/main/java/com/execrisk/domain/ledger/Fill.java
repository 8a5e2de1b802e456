package com.execrisk.domain.ledger;

import com.execrisk.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Fill(
    String fillId,
    UUID sliceId,
    UUID parentId,
    String instrument,
    OrderSide side,
    BigDecimal qty,
    BigDecimal price,
    BigDecimal fee,
    Instant executedAt) {

  public Fill {
    if (fillId == null || fillId.isBlank()) {
      throw new LedgerDomainException("fillId must not be blank");
    }
    Objects.requireNonNull(sliceId, "sliceId must not be null");
    Objects.requireNonNull(parentId, "parentId must not be null");
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(qty, "qty must not be null");
    Objects.requireNonNull(price, "price must not be null");
    fee = fee == null ? BigDecimal.ZERO : fee;
    Objects.requireNonNull(executedAt, "executedAt must not be null");
    if (qty.signum() <= 0) {
      throw new LedgerDomainException("qty must be > 0");
    }
    if (price.signum() <= 0) {
      throw new LedgerDomainException("price must be > 0");
    }
    if (fee.signum() < 0) {
      throw new LedgerDomainException("fee must be >= 0");
    }
  }

  public BigDecimal signedQty() {
    return side.signed(qty);
  }

  public BigDecimal notional() {
    return qty.multiply(price);
  }

  /** Cash effect of the fill: buys pay out, sells take in, fees always pay out. */
  public BigDecimal cashDelta() {
    return side.signed(notional()).negate().subtract(fee);
  }
}
