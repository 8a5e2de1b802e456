package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingParameters;
import java.math.BigDecimal;

/** Lot arithmetic. Quantities stay exact multiples of the lot size. */
public final class Lots {
  private static final BigDecimal MAX_SLICES = BigDecimal.valueOf(Integer.MAX_VALUE);

  private Lots() {}

  public static boolean isAligned(BigDecimal qty, BigDecimal lotSize) {
    return qty.remainder(lotSize).signum() == 0;
  }

  public static BigDecimal count(BigDecimal qty, BigDecimal lotSize) {
    return qty.divideToIntegralValue(lotSize);
  }

  public static BigDecimal floor(BigDecimal qty, BigDecimal lotSize) {
    return count(qty, lotSize).multiply(lotSize);
  }

  static BigDecimal requireLotSize(BigDecimal lotSize) {
    if (lotSize == null || lotSize.signum() <= 0) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "lotSize must be > 0");
    }
    return lotSize;
  }

  static BigDecimal requireAligned(BigDecimal qty, BigDecimal lotSize) {
    if (!isAligned(qty, lotSize)) {
      throw new OrderDomainException(
          OrderIntent.QTY_LOT_MISMATCH, "qty " + qty + " is not a multiple of lot " + lotSize);
    }
    return qty;
  }

  /** A sequence is indexed by int, so a schedule can hold at most that many slices. */
  static int requireSliceCount(BigDecimal count) {
    if (count.compareTo(MAX_SLICES) > 0) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS,
          count + " slices exceed the limit of " + MAX_SLICES);
    }
    return count.intValueExact();
  }

  /** Clip rounded down to whole lots; a clip smaller than one lot is invalid. */
  static BigDecimal requireClip(BigDecimal clipSize, BigDecimal lotSize) {
    BigDecimal clip = floor(clipSize, lotSize);
    if (clip.signum() <= 0) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS,
          "clipSize " + clipSize + " is smaller than lot " + lotSize);
    }
    return clip;
  }
}
