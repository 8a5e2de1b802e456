package com.execrisk.engine.scheduler;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** Values used when an intent leaves a pacing parameter unset. */
public record PacingDefaults(
    Duration twapHorizon,
    int twapSliceCount,
    Duration vwapHorizon,
    List<BigDecimal> vwapCurve,
    BigDecimal icebergClip,
    Duration icebergInterval,
    BigDecimal minSlippageClip,
    Duration minSlippageInterval,
    BigDecimal minSlippageTargetSpreadBps) {

  public PacingDefaults {
    Objects.requireNonNull(twapHorizon, "twapHorizon must not be null");
    if (twapSliceCount < 1) {
      throw new IllegalArgumentException("twapSliceCount must be >= 1");
    }
    Objects.requireNonNull(vwapHorizon, "vwapHorizon must not be null");
    vwapCurve = List.copyOf(Objects.requireNonNull(vwapCurve, "vwapCurve must not be null"));
    Objects.requireNonNull(icebergClip, "icebergClip must not be null");
    Objects.requireNonNull(icebergInterval, "icebergInterval must not be null");
    Objects.requireNonNull(minSlippageClip, "minSlippageClip must not be null");
    Objects.requireNonNull(minSlippageInterval, "minSlippageInterval must not be null");
    Objects.requireNonNull(minSlippageTargetSpreadBps, "minSlippageTargetSpreadBps");
  }

  /** One hour TWAP in five-minute slices, 100-lot iceberg clips every 30 seconds. */
  public static PacingDefaults standard() {
    return new PacingDefaults(
        Duration.ofMinutes(60),
        12,
        Duration.ofMinutes(60),
        List.of(
            new BigDecimal("1.4"),
            new BigDecimal("1.1"),
            new BigDecimal("0.9"),
            new BigDecimal("0.8"),
            new BigDecimal("0.8"),
            new BigDecimal("0.9"),
            new BigDecimal("1.1"),
            new BigDecimal("1.4")),
        new BigDecimal("100"),
        Duration.ofSeconds(30),
        new BigDecimal("100"),
        Duration.ofSeconds(10),
        new BigDecimal("5"));
  }
}
