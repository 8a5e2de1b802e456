package com.execrisk.engine.monitor;

import com.execrisk.domain.ledger.LedgerInconsistencyException;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.risk.Alert;
import com.execrisk.domain.risk.RiskRuleId;
import com.execrisk.engine.lifecycle.SliceEventListener;
import java.time.Clock;
import java.util.Objects;

/** Raises a CRITICAL alert whenever the ledger refuses a fill. */
public class LedgerInconsistencyAlerts implements SliceEventListener {
  private final AlertFeed alerts;
  private final Clock clock;

  public LedgerInconsistencyAlerts(AlertFeed alerts, Clock clock) {
    this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  @Override
  public void onLedgerInconsistency(ChildOrderSlice slice, LedgerInconsistencyException ex) {
    alerts.append(
        Alert.raise(
            RiskRuleId.LEDGER_INCONSISTENCY,
            "parent "
                + slice.parentId()
                + " failed, slice "
                + slice.index()
                + ": "
                + ex.getMessage(),
            clock.instant()));
  }
}
