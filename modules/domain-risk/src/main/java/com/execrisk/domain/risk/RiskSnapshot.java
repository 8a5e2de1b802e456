package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

public record RiskSnapshot(
    BigDecimal exposurePercent,
    BigDecimal riskPercent,
    BigDecimal drawdownPercent,
    BigDecimal sessionPnl,
    BigDecimal portfolioValue,
    List<RiskRuleId> breached,
    long trailingAlertCount,
    Instant takenAt) {

  public RiskSnapshot {
    Objects.requireNonNull(exposurePercent, "exposurePercent must not be null");
    Objects.requireNonNull(riskPercent, "riskPercent must not be null");
    Objects.requireNonNull(drawdownPercent, "drawdownPercent must not be null");
    Objects.requireNonNull(sessionPnl, "sessionPnl must not be null");
    Objects.requireNonNull(portfolioValue, "portfolioValue must not be null");
    breached = List.copyOf(Objects.requireNonNull(breached, "breached must not be null"));
    Objects.requireNonNull(takenAt, "takenAt must not be null");
  }

  public static RiskSnapshot empty(Instant now) {
    return new RiskSnapshot(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        List.of(),
        0,
        now);
  }

  public boolean isBreached(RiskRuleId ruleId) {
    return breached.contains(ruleId);
  }
}
