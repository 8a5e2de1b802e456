package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.util.Optional;

public final class MaxLossRule implements RiskRule {
  @Override
  public RiskRuleId id() {
    return RiskRuleId.MAX_LOSS;
  }

  @Override
  public Optional<RuleViolation> check(RiskEvaluationContext context) {
    BigDecimal limit = context.limits().maxLoss();
    if (!RiskLimitConfig.isEnabled(limit)) {
      return Optional.empty();
    }
    BigDecimal sessionPnl = context.sessionPnl();
    if (sessionPnl.compareTo(limit.negate()) >= 0) {
      return Optional.empty();
    }
    return Optional.of(
        new RuleViolation(
            id(),
            "MAX_LOSS_EXCEEDED",
            "Session loss " + sessionPnl.negate() + " exceeds maximum " + limit,
            RiskAction.REJECT,
            sessionPnl.negate(),
            limit));
  }
}
