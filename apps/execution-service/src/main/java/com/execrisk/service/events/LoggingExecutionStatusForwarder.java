package com.execrisk.service.events;

import com.execrisk.engine.scheduler.ExecutionReport;
import com.execrisk.engine.scheduler.ExecutionStatusListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingExecutionStatusForwarder implements ExecutionStatusListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingExecutionStatusForwarder.class);

  @Override
  public void onParentCompleted(ExecutionReport report) {
    log.info(
        "Execution feed stub orderId={} instrument={} status={} filledQty={} targetQty={}"
            + " reason={}",
        report.parentId(),
        report.instrument(),
        report.status(),
        report.filledQty(),
        report.targetQty(),
        report.reason());
  }
}
