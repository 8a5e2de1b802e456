package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.AggregatePosition;
import com.execrisk.domain.risk.DrawdownTracker;
import java.math.BigDecimal;
import java.util.Objects;

/** Aggregate state plus the session markers, taken under one ledger read. */
public record PortfolioView(
    AggregatePosition aggregate, BigDecimal sessionBaselinePnl, BigDecimal peakPortfolioValue) {

  public PortfolioView {
    Objects.requireNonNull(aggregate, "aggregate must not be null");
    Objects.requireNonNull(sessionBaselinePnl, "sessionBaselinePnl must not be null");
    Objects.requireNonNull(peakPortfolioValue, "peakPortfolioValue must not be null");
  }

  public BigDecimal sessionPnl() {
    return aggregate.totalPnl().subtract(sessionBaselinePnl);
  }

  public BigDecimal drawdownPercent() {
    return DrawdownTracker.drawdownPercent(peakPortfolioValue, aggregate.portfolioValue());
  }
}
