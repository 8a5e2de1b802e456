package com.execrisk.domain.orders;

public enum ParentOrderStatus {
  WORKING,
  FILLED,
  PARTIALLY_EXECUTED,
  CANCELED,
  FAILED;

  public boolean isTerminal() {
    return this != WORKING;
  }
}
