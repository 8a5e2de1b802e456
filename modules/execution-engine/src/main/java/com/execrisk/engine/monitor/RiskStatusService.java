package com.execrisk.engine.monitor;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/** Latest monitor result; reads never block. */
public class RiskStatusService {
  private final AtomicReference<RiskStatus> latest;

  public RiskStatusService(Clock clock) {
    this.latest = new AtomicReference<>(RiskStatus.initial(clock.instant()));
  }

  public RiskStatus latest() {
    return latest.get();
  }

  void update(RiskStatus status) {
    latest.set(Objects.requireNonNull(status, "status must not be null"));
  }
}
