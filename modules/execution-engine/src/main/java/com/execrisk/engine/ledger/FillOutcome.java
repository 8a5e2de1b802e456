package com.execrisk.engine.ledger;

public enum FillOutcome {
  APPLIED("applied"),
  DUPLICATE("duplicate"),
  REJECTED("rejected"),
  JOURNAL_FAILED("journal_failed"),
  UNMAPPED("unmapped");

  private final String metricTag;

  FillOutcome(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
