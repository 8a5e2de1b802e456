package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.util.Optional;

public final class MaxDrawdownRule implements RiskRule {
  @Override
  public RiskRuleId id() {
    return RiskRuleId.MAX_DRAWDOWN;
  }

  @Override
  public Optional<RuleViolation> check(RiskEvaluationContext context) {
    BigDecimal limit = context.limits().maxDrawdownPercent();
    if (!RiskLimitConfig.isEnabled(limit)) {
      return Optional.empty();
    }
    BigDecimal value = context.aggregate().portfolioValue();
    BigDecimal peak = context.peakPortfolioValue().max(value);
    if (peak.signum() <= 0) {
      return Optional.empty();
    }
    BigDecimal drawdown = DrawdownTracker.drawdownPercent(peak, value);
    if (drawdown.compareTo(limit) <= 0) {
      return Optional.empty();
    }
    return Optional.of(
        new RuleViolation(
            id(),
            "MAX_DRAWDOWN_EXCEEDED",
            "Drawdown "
                + drawdown.stripTrailingZeros().toPlainString()
                + "% exceeds maximum "
                + limit
                + "%",
            RiskAction.REJECT,
            drawdown,
            limit));
  }
}
