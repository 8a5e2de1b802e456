package com.execrisk.engine.scheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.function.IntFunction;

/**
 * Slices on a fixed clock: period {@code p} is due {@code p * interval} after the first. Periods
 * with zero quantity are skipped, but their time still passes.
 */
final class FixedIntervalSequence implements SliceSequence {
  private final int periods;
  private final Duration interval;
  private final IntFunction<BigDecimal> quantityAt;
  private int period;
  private int lastEmittedPeriod;
  private int emitted;

  FixedIntervalSequence(int periods, Duration interval, IntFunction<BigDecimal> quantityAt) {
    this.periods = periods;
    this.interval = interval;
    this.quantityAt = quantityAt;
  }

  @Override
  public boolean hasNext() {
    skipEmpty();
    return period < periods;
  }

  @Override
  public Duration nextDelay() {
    if (!hasNext()) {
      return Duration.ZERO;
    }
    return interval.multipliedBy(period - lastEmittedPeriod);
  }

  @Override
  public PlannedSlice next() {
    if (!hasNext()) {
      throw new NoSuchElementException("slice sequence exhausted");
    }
    PlannedSlice slice = new PlannedSlice(emitted, quantityAt.apply(period), nextDelay());
    lastEmittedPeriod = period;
    period++;
    emitted++;
    return slice;
  }

  private void skipEmpty() {
    while (period < periods && quantityAt.apply(period).signum() == 0) {
      period++;
    }
  }
}
