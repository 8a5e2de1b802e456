package com.execrisk.engine.ledger;

import com.execrisk.domain.ledger.Fill;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryLedgerJournal implements LedgerJournal {
  private final List<Fill> fills = new CopyOnWriteArrayList<>();

  @Override
  public void append(Fill fill) {
    fills.add(Objects.requireNonNull(fill, "fill must not be null"));
  }

  @Override
  public List<Fill> entries() {
    return List.copyOf(fills);
  }
}
