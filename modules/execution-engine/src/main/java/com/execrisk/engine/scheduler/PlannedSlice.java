package com.execrisk.engine.scheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

public record PlannedSlice(int index, BigDecimal qty, Duration delayBeforeEmission) {
  public PlannedSlice {
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0");
    }
    Objects.requireNonNull(qty, "qty must not be null");
    if (qty.signum() <= 0) {
      throw new IllegalArgumentException("qty must be > 0");
    }
    Objects.requireNonNull(delayBeforeEmission, "delayBeforeEmission must not be null");
  }
}
