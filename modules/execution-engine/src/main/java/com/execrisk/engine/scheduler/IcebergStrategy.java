package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Objects;

/** Shows one clip at a time; the final clip is whatever remains. */
public record IcebergStrategy(BigDecimal clipSize, Duration interval, BigDecimal lotSize)
    implements PacingStrategy {

  public IcebergStrategy {
    lotSize = Lots.requireLotSize(lotSize);
    Objects.requireNonNull(clipSize, "clipSize must not be null");
    clipSize = Lots.requireClip(clipSize, lotSize);
    Objects.requireNonNull(interval, "interval must not be null");
    if (interval.isNegative()) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "interval must be >= 0");
    }
  }

  @Override
  public PacingAlgorithm algorithm() {
    return PacingAlgorithm.ICEBERG;
  }

  @Override
  public void requireSchedulable(OrderIntent intent) {
    clipCount(Lots.requireAligned(intent.qty(), lotSize));
  }

  @Override
  public SliceSequence schedule(OrderIntent intent) {
    BigDecimal total = Lots.requireAligned(intent.qty(), lotSize);
    BigDecimal clip = clipSize;
    int clips = clipCount(total);
    BigDecimal last = total.subtract(clip.multiply(BigDecimal.valueOf(clips - 1L)));
    return new FixedIntervalSequence(
        clips, interval, period -> period < clips - 1 ? clip : last);
  }

  private int clipCount(BigDecimal total) {
    return Lots.requireSliceCount(total.divide(clipSize, 0, RoundingMode.CEILING));
  }
}
