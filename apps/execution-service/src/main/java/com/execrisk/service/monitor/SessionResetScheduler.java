package com.execrisk.service.monitor;

import com.execrisk.engine.ledger.PortfolioView;
import com.execrisk.engine.ledger.PositionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Starts a new trading session: loss baseline and drawdown peak move to the current state. */
@Component
@ConditionalOnProperty(
    prefix = "execrisk.session",
    name = "reset-enabled",
    havingValue = "true",
    matchIfMissing = false)
public class SessionResetScheduler {
  private static final Logger log = LoggerFactory.getLogger(SessionResetScheduler.class);

  private final PositionLedger ledger;

  public SessionResetScheduler(PositionLedger ledger) {
    this.ledger = ledger;
  }

  @Scheduled(cron = "${execrisk.session.reset-cron:0 0 0 * * *}", zone = "UTC")
  public void runScheduled() {
    PortfolioView view = ledger.resetSession();
    log.info(
        "Trading session reset baselinePnl={} peakPortfolioValue={}",
        view.sessionBaselinePnl(),
        view.peakPortfolioValue());
  }
}
