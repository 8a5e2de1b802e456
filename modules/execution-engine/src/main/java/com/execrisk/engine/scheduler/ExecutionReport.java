package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.ParentOrderStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * State of a parent order; terminal once {@code status} is anything but WORKING. {@code
 * avgFillPrice} is null until something fills and {@code arrivalMid} is null when no quote was
 * available at start.
 */
public record ExecutionReport(
    UUID parentId,
    String instrument,
    OrderSide side,
    PacingAlgorithm algorithm,
    ParentOrderStatus status,
    BigDecimal targetQty,
    BigDecimal scheduledQty,
    BigDecimal filledQty,
    BigDecimal avgFillPrice,
    BigDecimal arrivalMid,
    int slicesEmitted,
    String reason,
    Instant updatedAt) {
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  public ExecutionReport {
    Objects.requireNonNull(parentId, "parentId must not be null");
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(algorithm, "algorithm must not be null");
    Objects.requireNonNull(status, "status must not be null");
    Objects.requireNonNull(targetQty, "targetQty must not be null");
    Objects.requireNonNull(scheduledQty, "scheduledQty must not be null");
    Objects.requireNonNull(filledQty, "filledQty must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  /**
   * Implementation shortfall against the arrival mid in basis points. Positive means the fills
   * were worse than the mid: paid above it on a buy, received below it on a sell.
   */
  public Optional<BigDecimal> slippageBps() {
    if (avgFillPrice == null || arrivalMid == null || arrivalMid.signum() == 0) {
      return Optional.empty();
    }
    BigDecimal move = avgFillPrice.subtract(arrivalMid);
    if (side == OrderSide.SELL) {
      move = move.negate();
    }
    return Optional.of(move.multiply(BPS).divide(arrivalMid, 4, RoundingMode.HALF_UP));
  }
}
