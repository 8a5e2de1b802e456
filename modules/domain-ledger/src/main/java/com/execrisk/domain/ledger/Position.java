package com.execrisk.domain.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

public record Position(
    String instrument,
    BigDecimal qty,
    BigDecimal avgCost,
    BigDecimal realizedPnl,
    BigDecimal markPrice,
    Instant updatedAt) {
  static final int PRICE_SCALE = 10;

  public Position {
    if (instrument == null || instrument.isBlank()) {
      throw new LedgerDomainException("instrument must not be blank");
    }
    Objects.requireNonNull(qty, "qty must not be null");
    Objects.requireNonNull(avgCost, "avgCost must not be null");
    Objects.requireNonNull(realizedPnl, "realizedPnl must not be null");
    Objects.requireNonNull(markPrice, "markPrice must not be null");
    if (avgCost.signum() < 0) {
      throw new LedgerDomainException("avgCost must be >= 0");
    }
    if (markPrice.signum() < 0) {
      throw new LedgerDomainException("markPrice must be >= 0");
    }
  }

  public static Position flat(String instrument) {
    return new Position(
        instrument, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, null);
  }

  public boolean isFlat() {
    return qty.signum() == 0;
  }

  public BigDecimal unrealizedPnl() {
    if (isFlat()) {
      return BigDecimal.ZERO;
    }
    return markPrice.subtract(avgCost).multiply(qty);
  }

  public BigDecimal marketValue() {
    return qty.multiply(markPrice);
  }

  public BigDecimal grossExposure() {
    return marketValue().abs();
  }

  /** Loss against average cost in percent, zero when flat or in profit. */
  public BigDecimal unrealizedLossPercent() {
    BigDecimal move = movePercent();
    return move.signum() < 0 ? move.negate() : BigDecimal.ZERO;
  }

  /** Gain against average cost in percent, zero when flat or at a loss. */
  public BigDecimal unrealizedGainPercent() {
    BigDecimal move = movePercent();
    return move.signum() > 0 ? move : BigDecimal.ZERO;
  }

  private BigDecimal movePercent() {
    if (isFlat() || avgCost.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return markPrice
        .subtract(avgCost)
        .multiply(BigDecimal.valueOf(qty.signum()))
        .multiply(BigDecimal.valueOf(100))
        .divide(avgCost, PRICE_SCALE, RoundingMode.HALF_EVEN);
  }

  /**
   * Weighted-average-cost update. Fills that reduce the position realize PnL at the prior average
   * cost; a fill that crosses zero opens the residual at the fill price.
   */
  public Position apply(Fill fill) {
    Objects.requireNonNull(fill, "fill must not be null");
    if (!instrument.equals(fill.instrument())) {
      throw new LedgerDomainException(
          "fill instrument " + fill.instrument() + " does not match position " + instrument);
    }
    BigDecimal delta = fill.signedQty();
    BigDecimal nextQty = qty.add(delta);
    BigDecimal nextAvg;
    BigDecimal nextRealized = realizedPnl;

    if (qty.signum() == 0 || qty.signum() == delta.signum()) {
      BigDecimal held = qty.abs();
      nextAvg =
          held.multiply(avgCost)
              .add(fill.qty().multiply(fill.price()))
              .divide(held.add(fill.qty()), PRICE_SCALE, RoundingMode.HALF_EVEN);
    } else {
      BigDecimal closed = qty.abs().min(fill.qty());
      BigDecimal perUnit =
          fill.price().subtract(avgCost).multiply(BigDecimal.valueOf(qty.signum()));
      nextRealized = realizedPnl.add(perUnit.multiply(closed));
      if (nextQty.signum() == 0) {
        nextAvg = BigDecimal.ZERO;
      } else if (nextQty.signum() == qty.signum()) {
        nextAvg = avgCost;
      } else {
        nextAvg = fill.price();
      }
    }
    return new Position(
        instrument, nextQty, nextAvg, nextRealized, fill.price(), fill.executedAt());
  }

  public Position markedAt(BigDecimal price, Instant now) {
    Objects.requireNonNull(price, "price must not be null");
    if (price.signum() <= 0) {
      throw new LedgerDomainException("mark price must be > 0");
    }
    return new Position(instrument, qty, avgCost, realizedPnl, price, now);
  }
}
