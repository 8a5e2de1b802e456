package com.execrisk.domain.risk;

public enum RiskRuleId {
  MAX_SIZE,
  MAX_LOSS,
  MAX_DRAWDOWN,
  STOP_LOSS,
  MAX_EXPOSURE,
  MAX_RISK,
  TAKE_PROFIT,
  LEDGER_INCONSISTENCY;

  public AlertSeverity alertSeverity() {
    if (this == MAX_DRAWDOWN || this == MAX_LOSS || this == LEDGER_INCONSISTENCY) {
      return AlertSeverity.CRITICAL;
    }
    if (this == MAX_SIZE || this == STOP_LOSS || this == MAX_EXPOSURE || this == MAX_RISK) {
      return AlertSeverity.WARNING;
    }
    return AlertSeverity.INFO;
  }
}
