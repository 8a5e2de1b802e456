package com.execrisk.engine.scheduler;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Follows a volume curve. Weights are normalized; slice i is round(w_i * total) in lots, capped at
 * what is left, and the final bucket takes the rounding residue.
 */
public record VwapStrategy(Duration horizon, List<BigDecimal> weights, BigDecimal lotSize)
    implements PacingStrategy {

  public VwapStrategy {
    Objects.requireNonNull(horizon, "horizon must not be null");
    if (horizon.isNegative()) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "horizon must be >= 0");
    }
    weights = List.copyOf(Objects.requireNonNull(weights, "weights must not be null"));
    if (weights.isEmpty()) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "volume curve must not be empty");
    }
    BigDecimal sum = BigDecimal.ZERO;
    for (BigDecimal weight : weights) {
      if (weight.signum() < 0) {
        throw new OrderDomainException(
            PacingParameters.INVALID_PACING_PARAMETERS, "volume curve weights must be >= 0");
      }
      sum = sum.add(weight);
    }
    if (sum.signum() == 0) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "volume curve must have a positive weight");
    }
    lotSize = Lots.requireLotSize(lotSize);
  }

  @Override
  public PacingAlgorithm algorithm() {
    return PacingAlgorithm.VWAP;
  }

  @Override
  public SliceSequence schedule(OrderIntent intent) {
    BigDecimal total = Lots.requireAligned(intent.qty(), lotSize);
    List<BigDecimal> quantities = quantities(total);
    return new FixedIntervalSequence(
        quantities.size(), horizon.dividedBy(quantities.size()), quantities::get);
  }

  List<BigDecimal> quantities(BigDecimal total) {
    BigDecimal totalLots = Lots.count(total, lotSize);
    BigDecimal weightSum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    BigDecimal remainingLots = totalLots;
    List<BigDecimal> quantities = new ArrayList<>(weights.size());
    for (int i = 0; i < weights.size(); i++) {
      BigDecimal lots;
      if (i == weights.size() - 1) {
        lots = remainingLots;
      } else {
        lots =
            weights.get(i)
                .multiply(totalLots)
                .divide(weightSum, 0, RoundingMode.HALF_UP)
                .min(remainingLots);
      }
      remainingLots = remainingLots.subtract(lots);
      quantities.add(lots.multiply(lotSize));
    }
    return quantities;
  }
}
