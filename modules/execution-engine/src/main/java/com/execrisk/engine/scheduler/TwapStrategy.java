package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Equal slices over the horizon. Each slice is the floor of total/N in lots and the last one takes
 * the remainder; N shrinks when the total holds fewer lots than N.
 */
public record TwapStrategy(Duration horizon, int sliceCount, BigDecimal lotSize)
    implements PacingStrategy {

  public TwapStrategy {
    Objects.requireNonNull(horizon, "horizon must not be null");
    if (horizon.isNegative()) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "horizon must be >= 0");
    }
    if (sliceCount < 1) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "sliceCount must be >= 1");
    }
    lotSize = Lots.requireLotSize(lotSize);
  }

  @Override
  public PacingAlgorithm algorithm() {
    return PacingAlgorithm.TWAP;
  }

  @Override
  public SliceSequence schedule(OrderIntent intent) {
    BigDecimal total = Lots.requireAligned(intent.qty(), lotSize);
    BigDecimal totalLots = Lots.count(total, lotSize);
    int slices = totalLots.min(BigDecimal.valueOf(sliceCount)).intValueExact();
    BigDecimal perSlice =
        totalLots.divideToIntegralValue(BigDecimal.valueOf(slices)).multiply(lotSize);
    BigDecimal last = total.subtract(perSlice.multiply(BigDecimal.valueOf(slices - 1L)));
    return new FixedIntervalSequence(
        slices, horizon.dividedBy(slices), period -> period < slices - 1 ? perSlice : last);
  }
}
