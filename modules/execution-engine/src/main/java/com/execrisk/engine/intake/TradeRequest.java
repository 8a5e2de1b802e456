package com.execrisk.engine.intake;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/** Unvalidated caller input; {@link TradeIntakeService} turns it into an {@link OrderIntent}. */
public record TradeRequest(
    String instrument,
    OrderSide side,
    BigDecimal qty,
    PacingAlgorithm algorithm,
    PacingParameters pacing,
    BigDecimal limitPrice) {

  OrderIntent toIntent(Instant now) {
    if (side == null) {
      throw new OrderDomainException("side is required");
    }
    if (algorithm == null) {
      throw new OrderDomainException(
          PacingParameters.INVALID_PACING_PARAMETERS, "algorithm is required");
    }
    return new OrderIntent(
        UUID.randomUUID(), instrument, side, qty, algorithm, pacing, limitPrice, now);
  }
}
