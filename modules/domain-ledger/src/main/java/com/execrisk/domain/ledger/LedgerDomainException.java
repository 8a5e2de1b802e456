package com.execrisk.domain.ledger;

public class LedgerDomainException extends RuntimeException {
  private final String code;

  public LedgerDomainException(String message) {
    this("INVALID_LEDGER_ENTRY", message);
  }

  public LedgerDomainException(String code, String message) {
    super(message);
    this.code = code;
  }

  public String code() {
    return code;
  }
}
