package com.execrisk.engine.monitor;

public enum EscalationMode {
  /** Alerts are informational only. */
  NONE,
  /** A CRITICAL crossing halts intake and cancels every working parent. */
  HALT_AND_CANCEL
}
