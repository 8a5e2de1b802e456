package com.execrisk.engine.risk;

import com.execrisk.domain.risk.RiskLimitConfig;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Current risk limits. Evaluations read {@link #current()} once and use that value throughout. */
public class RiskLimitConfigHolder {
  private static final Logger log = LoggerFactory.getLogger(RiskLimitConfigHolder.class);

  private final AtomicReference<RiskLimitConfig> current;

  public RiskLimitConfigHolder(RiskLimitConfig initial) {
    Objects.requireNonNull(initial, "initial must not be null");
    this.current = new AtomicReference<>(initial);
  }

  public RiskLimitConfig current() {
    return current.get();
  }

  /** Swaps the limits; returns the previous config. */
  public RiskLimitConfig reconfigure(RiskLimitConfig next) {
    Objects.requireNonNull(next, "next must not be null");
    RiskLimitConfig previous = current.getAndSet(next);
    if (!previous.equals(next)) {
      log.info("Risk limits reconfigured previous={} next={}", previous, next);
    }
    return previous;
  }
}
