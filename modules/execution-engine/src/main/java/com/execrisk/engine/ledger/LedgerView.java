package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.Position;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Consistent read used for one risk decision: the instrument's position, the portfolio, and how
 * much of a parent order has already filled.
 */
public record LedgerView(Position position, PortfolioView portfolio, BigDecimal parentFilledQty) {
  public LedgerView {
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(portfolio, "portfolio must not be null");
    parentFilledQty = parentFilledQty == null ? BigDecimal.ZERO : parentFilledQty;
  }
}
