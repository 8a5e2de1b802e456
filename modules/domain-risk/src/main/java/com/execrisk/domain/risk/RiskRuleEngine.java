package com.execrisk.domain.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Runs every rule in order and reports every violation. */
public final class RiskRuleEngine {
  private final List<RiskRule> rules;

  public RiskRuleEngine(List<RiskRule> rules) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules must not be null"));
  }

  public static RiskRuleEngine standard() {
    return new RiskRuleEngine(
        List.of(
            new MaxSizeRule(),
            new MaxLossRule(),
            new MaxDrawdownRule(),
            new StopLossRule(),
            new MaxExposureRule()));
  }

  public RiskDecision evaluate(RiskEvaluationContext context) {
    Objects.requireNonNull(context, "context must not be null");
    List<RuleViolation> violations = new ArrayList<>();
    for (RiskRule rule : rules) {
      rule.check(context).ifPresent(violations::add);
    }
    return new RiskDecision(violations, context.now());
  }

  public List<RiskRule> rules() {
    return rules;
  }
}
