package com.execrisk.service.monitor;

import com.execrisk.engine.ledger.PositionMarker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Re-marks open positions from the latest quotes so the monitor sees current prices. */
@Component
@ConditionalOnProperty(
    prefix = "execrisk.marks",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class PositionMarkScheduler {
  private static final Logger log = LoggerFactory.getLogger(PositionMarkScheduler.class);

  private final PositionMarker positionMarker;

  public PositionMarkScheduler(PositionMarker positionMarker) {
    this.positionMarker = positionMarker;
  }

  @Scheduled(fixedRateString = "${execrisk.marks.fixed-rate-ms:1000}")
  public void runScheduled() {
    try {
      positionMarker.markAll();
    } catch (RuntimeException ex) {
      log.error("Position marking failed", ex);
    }
  }
}
