package com.execrisk.engine.intake;

public class TradingHaltedException extends RuntimeException {
  public static final String CODE = "TRADING_HALTED";

  private final String haltReason;

  public TradingHaltedException(String haltReason) {
    super("Trading is halted: " + haltReason);
    this.haltReason = haltReason;
  }

  public String code() {
    return CODE;
  }

  public String haltReason() {
    return haltReason;
  }
}
