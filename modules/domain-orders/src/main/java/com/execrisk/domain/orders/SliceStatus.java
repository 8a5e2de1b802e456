package com.execrisk.domain.orders;

public enum SliceStatus {
  CREATED,
  SUBMITTED,
  PARTIALLY_FILLED,
  FILLED,
  CANCELED,
  REJECTED,
  FAILED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED || this == REJECTED || this == FAILED;
  }
}
