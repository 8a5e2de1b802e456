package com.execrisk.engine.lifecycle;

import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.orders.ChildOrderSlice;

public interface SliceEventListener {
  /** The slice reached FILLED, CANCELED, REJECTED or FAILED. */
  default void onSliceTerminal(ChildOrderSlice slice) {}

  default void onSliceUpdated(ChildOrderSlice slice) {}

  default void onLedgerInconsistency(ChildOrderSlice slice, LedgerInconsistencyException ex) {}
}
