package com.execrisk.domain.orders;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Optional knobs for a pacing algorithm. Any field left {@code null} falls back to the scheduler
 * defaults for that algorithm.
 */
public record PacingParameters(
    Duration horizon,
    Integer sliceCount,
    BigDecimal clipSize,
    Duration interval,
    List<BigDecimal> volumeCurve,
    BigDecimal targetSpreadBps) {
  public static final String INVALID_PACING_PARAMETERS = "INVALID_PACING_PARAMETERS";

  private static final PacingParameters NONE =
      new PacingParameters(null, null, null, null, null, null);

  public PacingParameters {
    if (horizon != null && horizon.isNegative()) {
      throw new OrderDomainException(INVALID_PACING_PARAMETERS, "horizon must be >= 0");
    }
    if (sliceCount != null && sliceCount < 1) {
      throw new OrderDomainException(INVALID_PACING_PARAMETERS, "sliceCount must be >= 1");
    }
    if (clipSize != null && clipSize.signum() <= 0) {
      throw new OrderDomainException(INVALID_PACING_PARAMETERS, "clipSize must be > 0");
    }
    if (interval != null && interval.isNegative()) {
      throw new OrderDomainException(INVALID_PACING_PARAMETERS, "interval must be >= 0");
    }
    if (volumeCurve != null) {
      volumeCurve = List.copyOf(volumeCurve);
      for (BigDecimal weight : volumeCurve) {
        if (weight.signum() < 0) {
          throw new OrderDomainException(
              INVALID_PACING_PARAMETERS, "volumeCurve weights must be >= 0");
        }
      }
    }
    if (targetSpreadBps != null && targetSpreadBps.signum() <= 0) {
      throw new OrderDomainException(INVALID_PACING_PARAMETERS, "targetSpreadBps must be > 0");
    }
  }

  public static PacingParameters none() {
    return NONE;
  }

  public static PacingParameters twap(Duration horizon, int sliceCount) {
    return new PacingParameters(horizon, sliceCount, null, null, null, null);
  }

  public static PacingParameters vwap(Duration horizon, List<BigDecimal> volumeCurve) {
    return new PacingParameters(horizon, null, null, null, volumeCurve, null);
  }

  public static PacingParameters iceberg(BigDecimal clipSize, Duration interval) {
    return new PacingParameters(null, null, clipSize, interval, null, null);
  }

  public static PacingParameters minSlippage(
      BigDecimal clipSize, Duration interval, BigDecimal targetSpreadBps) {
    return new PacingParameters(null, null, clipSize, interval, null, targetSpreadBps);
  }
}
