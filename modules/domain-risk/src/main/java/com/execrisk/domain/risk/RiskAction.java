package com.execrisk.domain.risk;

public enum RiskAction {
  REJECT,
  FORCE_FLATTEN
}
