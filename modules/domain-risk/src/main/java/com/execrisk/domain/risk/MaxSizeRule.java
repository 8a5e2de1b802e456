package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.util.Optional;

public final class MaxSizeRule implements RiskRule {
  @Override
  public RiskRuleId id() {
    return RiskRuleId.MAX_SIZE;
  }

  @Override
  public Optional<RuleViolation> check(RiskEvaluationContext context) {
    BigDecimal limit = context.limits().maxPositionSize();
    if (!RiskLimitConfig.isEnabled(limit)) {
      return Optional.empty();
    }
    BigDecimal resulting = context.resultingQty().abs();
    if (resulting.compareTo(limit) <= 0) {
      return Optional.empty();
    }
    return Optional.of(
        new RuleViolation(
            id(),
            "MAX_POSITION_SIZE_EXCEEDED",
            "Position size "
                + resulting
                + " for "
                + context.instrument()
                + " exceeds maximum "
                + limit,
            RiskAction.REJECT,
            resulting,
            limit));
  }
}
