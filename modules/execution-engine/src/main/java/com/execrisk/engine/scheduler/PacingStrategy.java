package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import com.execrisk.integration.venue.MarketDataProvider;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/** How a parent order is cut into slices over time. */
public sealed interface PacingStrategy
    permits TwapStrategy, VwapStrategy, IcebergStrategy, MinSlippageStrategy {

  PacingAlgorithm algorithm();

  /**
   * Fails with {@code INVALID_PACING_PARAMETERS} when {@code intent} cannot be scheduled, before
   * anything is started.
   */
  default void requireSchedulable(OrderIntent intent) {}

  /** Starts a fresh slice sequence for {@code intent}. */
  SliceSequence schedule(OrderIntent intent);

  /**
   * Resolves the intent's algorithm and parameters, filling gaps from {@code defaults}. Invalid
   * parameters raise {@code INVALID_PACING_PARAMETERS}.
   */
  static PacingStrategy forIntent(
      OrderIntent intent,
      BigDecimal lotSize,
      PacingDefaults defaults,
      MarketDataProvider marketData) {
    Objects.requireNonNull(intent, "intent must not be null");
    Objects.requireNonNull(defaults, "defaults must not be null");
    PacingParameters params = intent.pacing();
    PacingAlgorithm algorithm = intent.algorithm();
    if (algorithm == PacingAlgorithm.TWAP) {
      Duration horizon = orDefault(params.horizon(), defaults.twapHorizon());
      int sliceCount = defaults.twapSliceCount();
      if (params.sliceCount() != null) {
        sliceCount = params.sliceCount();
      } else if (params.interval() != null && !params.interval().isZero()) {
        sliceCount = (int) Math.max(1, horizon.toMillis() / params.interval().toMillis());
      }
      return new TwapStrategy(horizon, sliceCount, lotSize);
    }
    if (algorithm == PacingAlgorithm.VWAP) {
      List<BigDecimal> curve = orDefault(params.volumeCurve(), defaults.vwapCurve());
      return new VwapStrategy(orDefault(params.horizon(), defaults.vwapHorizon()), curve, lotSize);
    }
    if (algorithm == PacingAlgorithm.ICEBERG) {
      return new IcebergStrategy(
          orDefault(params.clipSize(), defaults.icebergClip()),
          orDefault(params.interval(), defaults.icebergInterval()),
          lotSize);
    }
    return new MinSlippageStrategy(
        orDefault(params.clipSize(), defaults.minSlippageClip()),
        orDefault(params.interval(), defaults.minSlippageInterval()),
        orDefault(params.targetSpreadBps(), defaults.minSlippageTargetSpreadBps()),
        lotSize,
        marketData);
  }

  private static <T> T orDefault(T value, T fallback) {
    return value == null ? fallback : value;
  }
}
