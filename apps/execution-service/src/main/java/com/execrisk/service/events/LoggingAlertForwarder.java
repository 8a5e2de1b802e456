package com.execrisk.service.events;

import com.execrisk.domain.risk.Alert;
import com.execrisk.engine.monitor.AlertSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingAlertForwarder implements AlertSubscriber {
  private static final Logger log = LoggerFactory.getLogger(LoggingAlertForwarder.class);

  @Override
  public void onAlert(Alert alert) {
    log.info(
        "Alert feed stub alertId={} severity={} rule={} message={} raisedAt={}",
        alert.id(),
        alert.severity(),
        alert.ruleId(),
        alert.message(),
        alert.raisedAt());
  }
}
