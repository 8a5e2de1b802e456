package com.execrisk.engine.monitor;

import com.execrisk.domain.risk.AlertSeverity;
import com.execrisk.domain.risk.RiskSnapshot;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record RiskStatus(
    RiskSnapshot snapshot, Map<AlertSeverity, Long> alertsBySeverity, boolean tradingHalted) {

  public RiskStatus {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    alertsBySeverity = Map.copyOf(Objects.requireNonNull(alertsBySeverity, "alertsBySeverity"));
  }

  public static RiskStatus initial(Instant now) {
    return new RiskStatus(RiskSnapshot.empty(now), Map.of(), false);
  }

  public long trailingAlertCount() {
    return snapshot.trailingAlertCount();
  }
}
