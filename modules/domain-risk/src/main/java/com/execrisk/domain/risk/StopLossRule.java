package com.execrisk.domain.risk;

import com.execrisk.domain.ledger.Position;
import java.math.BigDecimal;
import java.util.Optional;

/** Flags an open position whose loss against average cost is past the stop. Exits are allowed. */
public final class StopLossRule implements RiskRule {
  @Override
  public RiskRuleId id() {
    return RiskRuleId.STOP_LOSS;
  }

  @Override
  public Optional<RuleViolation> check(RiskEvaluationContext context) {
    BigDecimal limit = context.limits().stopLossPercent();
    Position position = context.position();
    if (!RiskLimitConfig.isEnabled(limit) || position.isFlat() || context.reducesPosition()) {
      return Optional.empty();
    }
    BigDecimal lossPercent = position.unrealizedLossPercent();
    if (lossPercent.compareTo(limit) <= 0) {
      return Optional.empty();
    }
    return Optional.of(
        new RuleViolation(
            id(),
            "STOP_LOSS_TRIGGERED",
            "Position "
                + position.instrument()
                + " is down "
                + lossPercent.stripTrailingZeros().toPlainString()
                + "% against stop "
                + limit
                + "%",
            context.limits().stopLossAction(),
            lossPercent,
            limit));
  }
}
