package com.execrisk.domain.risk;

import com.execrisk.domain.ledger.AggregatePosition;
import com.execrisk.domain.ledger.Position;
import com.execrisk.domain.orders.OrderSide;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Everything a rule may look at. The proposed change is {@code qty} on {@code side}, measured
 * against {@code position} as it stands in the ledger.
 */
public record RiskEvaluationContext(
    String instrument,
    OrderSide side,
    BigDecimal qty,
    BigDecimal referencePrice,
    Position position,
    AggregatePosition aggregate,
    RiskLimitConfig limits,
    BigDecimal sessionBaselinePnl,
    BigDecimal peakPortfolioValue,
    Instant now) {

  public RiskEvaluationContext {
    Objects.requireNonNull(instrument, "instrument must not be null");
    Objects.requireNonNull(side, "side must not be null");
    Objects.requireNonNull(qty, "qty must not be null");
    if (qty.signum() <= 0) {
      throw new IllegalArgumentException("qty must be > 0");
    }
    Objects.requireNonNull(position, "position must not be null");
    Objects.requireNonNull(aggregate, "aggregate must not be null");
    Objects.requireNonNull(limits, "limits must not be null");
    sessionBaselinePnl = sessionBaselinePnl == null ? BigDecimal.ZERO : sessionBaselinePnl;
    peakPortfolioValue = peakPortfolioValue == null ? BigDecimal.ZERO : peakPortfolioValue;
    Objects.requireNonNull(now, "now must not be null");
  }

  public BigDecimal resultingQty() {
    return position.qty().add(side.signed(qty));
  }

  public boolean reducesPosition() {
    return resultingQty().abs().compareTo(position.qty().abs()) < 0
        && resultingQty().signum() * position.qty().signum() >= 0;
  }

  /** Price used to value the proposed change: the caller's reference, else the current mark. */
  public BigDecimal valuationPrice() {
    if (referencePrice != null && referencePrice.signum() > 0) {
      return referencePrice;
    }
    return position.markPrice();
  }

  public BigDecimal sessionPnl() {
    return aggregate.totalPnl().subtract(sessionBaselinePnl);
  }
}
