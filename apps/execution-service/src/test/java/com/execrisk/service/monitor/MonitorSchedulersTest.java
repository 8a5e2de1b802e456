package com.execrisk.service.monitor;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.execrisk.engine.ledger.InMemoryLedgerJournal;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.ledger.PositionMarker;
import com.execrisk.engine.monitor.RiskMonitor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MonitorSchedulersTest {
  @Mock private RiskMonitor riskMonitor;
  @Mock private PositionMarker positionMarker;

  @Test
  void shouldKeepTickingAfterFailedTick() {
    when(riskMonitor.tick()).thenThrow(new IllegalStateException("ledger busy")).thenReturn(null);
    RiskMonitorScheduler scheduler = new RiskMonitorScheduler(riskMonitor);

    assertDoesNotThrow(scheduler::runScheduled);
    assertDoesNotThrow(scheduler::runScheduled);

    verify(riskMonitor, times(2)).tick();
  }

  @Test
  void shouldKeepMarkingAfterFailedPass() {
    when(positionMarker.markAll()).thenThrow(new IllegalStateException("no quotes")).thenReturn(1);
    PositionMarkScheduler scheduler = new PositionMarkScheduler(positionMarker);

    assertDoesNotThrow(scheduler::runScheduled);
    assertDoesNotThrow(scheduler::runScheduled);

    verify(positionMarker, times(2)).markAll();
  }

  @Test
  void shouldResetSessionMarkers() {
    PositionLedger ledger =
        new PositionLedger(
            new BigDecimal("100000"),
            new InMemoryLedgerJournal(),
            new SimpleMeterRegistry(),
            Clock.fixed(Instant.parse("2026-03-02T00:00:00Z"), ZoneOffset.UTC));

    new SessionResetScheduler(ledger).runScheduled();

    assertEquals(0, new BigDecimal("100000").compareTo(ledger.portfolio().peakPortfolioValue()));
    assertEquals(0, BigDecimal.ZERO.compareTo(ledger.portfolio().sessionPnl()));
  }
}
