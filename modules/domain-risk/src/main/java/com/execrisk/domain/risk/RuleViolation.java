package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.util.Objects;

public record RuleViolation(
    RiskRuleId ruleId,
    String reasonCode,
    String message,
    RiskAction action,
    BigDecimal observed,
    BigDecimal limit) {

  public RuleViolation {
    Objects.requireNonNull(ruleId, "ruleId must not be null");
    if (reasonCode == null || reasonCode.isBlank()) {
      throw new IllegalArgumentException("reasonCode must not be blank");
    }
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(action, "action must not be null");
  }
}
