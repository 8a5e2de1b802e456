package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.Fill;
import java.util.List;

/** Durable record of accepted fills. Called by the ledger while it holds its lock. */
public interface LedgerJournal {
  void append(Fill fill);

  List<Fill> entries();
}
