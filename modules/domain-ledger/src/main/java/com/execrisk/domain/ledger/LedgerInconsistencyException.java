package com.execrisk.domain.ledger;

import java.util.UUID;

public class LedgerInconsistencyException extends LedgerDomainException {
  public static final String CODE = "LEDGER_INCONSISTENCY";

  private final String fillId;
  private final UUID sliceId;

  public LedgerInconsistencyException(String fillId, UUID sliceId, String reason) {
    super(CODE, String.format("Ledger refused fill %s for slice %s: %s", fillId, sliceId, reason));
    this.fillId = fillId;
    this.sliceId = sliceId;
  }

  public String fillId() {
    return fillId;
  }

  public UUID sliceId() {
    return sliceId;
  }
}
