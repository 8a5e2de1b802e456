package com.execrisk.engine.risk;

import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.domain.risk.RuleViolation;
import java.util.List;
import java.util.Objects;

public class RiskRejectedException extends RuntimeException {
  public static final String CODE = "RISK_REJECTED";

  private final List<RuleViolation> violations;

  public RiskRejectedException(RiskDecision decision) {
    super("Risk rejected: " + Objects.requireNonNull(decision, "decision").summary());
    this.violations = decision.violations();
  }

  public String code() {
    return CODE;
  }

  public List<RuleViolation> violations() {
    return violations;
  }
}
