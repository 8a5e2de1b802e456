package com.execrisk.integration.venue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

public record Quote(String instrument, BigDecimal bid, BigDecimal ask, Instant quotedAt) {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  public Quote {
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(bid, "bid must not be null");
    Objects.requireNonNull(ask, "ask must not be null");
    Objects.requireNonNull(quotedAt, "quotedAt must not be null");
    if (bid.signum() <= 0 || ask.compareTo(bid) < 0) {
      throw new IllegalArgumentException("quote must satisfy 0 < bid <= ask");
    }
  }

  public BigDecimal mid() {
    return bid.add(ask).divide(TWO, 10, RoundingMode.HALF_EVEN);
  }

  public BigDecimal spreadBps() {
    return ask.subtract(bid).multiply(BPS).divide(mid(), 6, RoundingMode.HALF_UP);
  }
}
