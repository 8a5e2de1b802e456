package com.execrisk.service.monitor;

import com.execrisk.engine.monitor.RiskMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "execrisk.monitor",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RiskMonitorScheduler {
  private static final Logger log = LoggerFactory.getLogger(RiskMonitorScheduler.class);

  private final RiskMonitor riskMonitor;

  public RiskMonitorScheduler(RiskMonitor riskMonitor) {
    this.riskMonitor = riskMonitor;
  }

  @Scheduled(fixedRateString = "${execrisk.monitor.fixed-rate-ms:1000}")
  public void runScheduled() {
    try {
      riskMonitor.tick();
    } catch (RuntimeException ex) {
      log.error("Risk monitor tick failed", ex);
    }
  }
}
