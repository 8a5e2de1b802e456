package com.execrisk.domain.risk;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record Alert(
    UUID id, AlertSeverity severity, RiskRuleId ruleId, String message, Instant raisedAt) {

  public Alert {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(severity, "severity must not be null");
    Objects.requireNonNull(ruleId, "ruleId must not be null");
    Objects.requireNonNull(message, "message must not be null");
    Objects.requireNonNull(raisedAt, "raisedAt must not be null");
  }

  public static Alert raise(RiskRuleId ruleId, String message, Instant now) {
    return new Alert(UUID.randomUUID(), ruleId.alertSeverity(), ruleId, message, now);
  }
}
