package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/** Monotonic high-water mark of portfolio value. Only {@link #reset} moves it down. */
public final class DrawdownTracker {
  private final AtomicReference<BigDecimal> peak;

  public DrawdownTracker(BigDecimal initialPeak) {
    this.peak = new AtomicReference<>(Objects.requireNonNull(initialPeak, "initialPeak"));
  }

  public BigDecimal observe(BigDecimal value) {
    Objects.requireNonNull(value, "value must not be null");
    return peak.accumulateAndGet(value, BigDecimal::max);
  }

  public BigDecimal peak() {
    return peak.get();
  }

  public void reset(BigDecimal value) {
    peak.set(Objects.requireNonNull(value, "value must not be null"));
  }

  public static BigDecimal drawdownPercent(BigDecimal peak, BigDecimal value) {
    if (peak.signum() <= 0 || value.compareTo(peak) >= 0) {
      return BigDecimal.ZERO;
    }
    return peak.subtract(value)
        .multiply(BigDecimal.valueOf(100))
        .divide(peak, 6, RoundingMode.HALF_UP);
  }
}
