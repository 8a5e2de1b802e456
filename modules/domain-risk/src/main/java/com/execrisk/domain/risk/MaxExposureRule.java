package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

public final class MaxExposureRule implements RiskRule {
  @Override
  public RiskRuleId id() {
    return RiskRuleId.MAX_EXPOSURE;
  }

  @Override
  public Optional<RuleViolation> check(RiskEvaluationContext context) {
    BigDecimal limit = context.limits().maxExposurePercent();
    if (!RiskLimitConfig.isEnabled(limit)) {
      return Optional.empty();
    }
    BigDecimal price = context.valuationPrice();
    BigDecimal currentGross = context.aggregate().grossExposure();
    BigDecimal postTradeGross =
        currentGross
            .subtract(context.position().qty().multiply(price).abs())
            .add(context.resultingQty().multiply(price).abs());
    if (postTradeGross.compareTo(currentGross) <= 0) {
      return Optional.empty();
    }
    BigDecimal portfolioValue = context.aggregate().portfolioValue();
    if (portfolioValue.signum() <= 0) {
      return Optional.of(violation(postTradeGross, limit, "portfolio value is not positive"));
    }
    BigDecimal exposurePercent =
        postTradeGross
            .multiply(BigDecimal.valueOf(100))
            .divide(portfolioValue, 6, RoundingMode.HALF_UP);
    if (exposurePercent.compareTo(limit) <= 0) {
      return Optional.empty();
    }
    return Optional.of(
        violation(
            exposurePercent,
            limit,
            "post-trade exposure " + exposurePercent.stripTrailingZeros().toPlainString() + "%"));
  }

  private RuleViolation violation(BigDecimal observed, BigDecimal limit, String detail) {
    return new RuleViolation(
        id(),
        "MAX_EXPOSURE_EXCEEDED",
        "Exposure limit " + limit + "% exceeded: " + detail,
        RiskAction.REJECT,
        observed,
        limit);
  }
}
