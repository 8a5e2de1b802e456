package com.execrisk.engine.intake;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A tradable instrument. {@code stopDistance} is the fractional move used to size risk (0.05 means
 * 5%); when null the monitor falls back to the configured stop-loss percent.
 */
public record InstrumentSpec(String symbol, BigDecimal lotSize, BigDecimal stopDistance) {
  public InstrumentSpec {
    if (symbol == null || symbol.isBlank()) {
      throw new IllegalArgumentException("symbol must not be blank");
    }
    Objects.requireNonNull(lotSize, "lotSize must not be null");
    if (lotSize.signum() <= 0) {
      throw new IllegalArgumentException("lotSize must be > 0");
    }
    if (stopDistance != null && stopDistance.signum() < 0) {
      throw new IllegalArgumentException("stopDistance must be >= 0");
    }
  }
}
