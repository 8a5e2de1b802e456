package com.execrisk.domain.risk;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record RiskDecision(List<RuleViolation> violations, Instant evaluatedAt) {

  public RiskDecision {
    violations = List.copyOf(Objects.requireNonNull(violations, "violations must not be null"));
    Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
  }

  public boolean accepted() {
    return violations.isEmpty();
  }

  public boolean requiresFlatten() {
    return violations.stream().anyMatch(v -> v.action() == RiskAction.FORCE_FLATTEN);
  }

  public boolean violated(RiskRuleId ruleId) {
    return violations.stream().anyMatch(v -> v.ruleId() == ruleId);
  }

  public String summary() {
    if (accepted()) {
      return "accepted";
    }
    StringBuilder builder = new StringBuilder();
    for (RuleViolation violation : violations) {
      if (builder.length() > 0) {
        builder.append("; ");
      }
      builder.append(violation.ruleId()).append(": ").append(violation.message());
    }
    return builder.toString();
  }
}
