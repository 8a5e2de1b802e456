package com.execrisk.domain.risk;

public enum AlertSeverity {
  INFO,
  WARNING,
  CRITICAL
}
