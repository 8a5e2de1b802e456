package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import com.execrisk.integration.venue.MarketDataProvider;
import com.execrisk.integration.venue.Quote;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Sizes each slice from the spread at emission time: the tighter the market relative to the
 * target, the more of the remainder goes out, never more than one clip and never less than a lot.
 */
public record MinSlippageStrategy(
    BigDecimal clipSize,
    Duration interval,
    BigDecimal targetSpreadBps,
    BigDecimal lotSize,
    MarketDataProvider marketData)
    implements PacingStrategy {

  public MinSlippageStrategy {
    lotSize = Lots.requireLotSize(lotSize);
    Objects.requireNonNull(clipSize, "clipSize must not be null");
    clipSize = Lots.requireClip(clipSize, lotSize);
    Objects.requireNonNull(interval, "interval must not be null");
    if (interval.isNegative()) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "interval must be >= 0");
    }
    if (targetSpreadBps == null || targetSpreadBps.signum() <= 0) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "targetSpreadBps must be > 0");
    }
    Objects.requireNonNull(marketData, "marketData must not be null");
  }

  @Override
  public PacingAlgorithm algorithm() {
    return PacingAlgorithm.MIN_SLIPPAGE;
  }

  @Override
  public SliceSequence schedule(OrderIntent intent) {
    return new AdaptiveSequence(intent.instrument(), Lots.requireAligned(intent.qty(), lotSize));
  }

  /** Slice size for {@code remaining} given the current quote, before the clip cap. */
  BigDecimal sizeFor(BigDecimal remaining, Optional<Quote> quote) {
    BigDecimal size;
    if (quote.isEmpty()) {
      size = lotSize;
    } else {
      BigDecimal spread = quote.get().spreadBps();
      BigDecimal ratio = BigDecimal.ONE;
      if (spread.signum() > 0) {
        ratio = BigDecimal.ONE.min(targetSpreadBps.divide(spread, 10, RoundingMode.DOWN));
      }
      size = Lots.floor(remaining.multiply(ratio), lotSize).max(lotSize);
    }
    return size.min(clipSize).min(remaining);
  }

  private final class AdaptiveSequence implements SliceSequence {
    private final String instrument;
    private BigDecimal remaining;
    private int index;

    private AdaptiveSequence(String instrument, BigDecimal total) {
      this.instrument = instrument;
      this.remaining = total;
    }

    @Override
    public boolean hasNext() {
      return remaining.signum() > 0;
    }

    @Override
    public Duration nextDelay() {
      return index == 0 ? Duration.ZERO : interval;
    }

    @Override
    public PlannedSlice next() {
      if (!hasNext()) {
        throw new NoSuchElementException("slice sequence exhausted");
      }
      BigDecimal qty = sizeFor(remaining, marketData.latestQuote(instrument));
      PlannedSlice slice = new PlannedSlice(index, qty, nextDelay());
      remaining = remaining.subtract(qty);
      index++;
      return slice;
    }
  }
}
