package com.execrisk.domain.risk;

import java.util.Optional;

public sealed interface RiskRule
    permits MaxSizeRule, MaxLossRule, MaxDrawdownRule, StopLossRule, MaxExposureRule {

  RiskRuleId id();

  Optional<RuleViolation> check(RiskEvaluationContext context);
}
