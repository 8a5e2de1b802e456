package com.execrisk.engine.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.execrisk.domain.ledger.AggregatePosition;
import com.execrisk.domain.ledger.Position;
import com.execrisk.domain.risk.Alert;
import com.execrisk.domain.risk.AlertSeverity;
import com.execrisk.domain.risk.RiskAction;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.domain.risk.RiskRuleId;
import com.execrisk.domain.risk.RiskSnapshot;
import com.execrisk.engine.intake.InstrumentCatalog;
import com.execrisk.engine.intake.InstrumentSpec;
import com.execrisk.engine.intake.TradingControl;
import com.execrisk.engine.ledger.PortfolioView;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.risk.RiskLimitConfigHolder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RiskMonitorTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  @Mock private PositionLedger ledger;
  @Mock private ParentOrderCanceller canceller;

  private final AlertFeed alerts = new AlertFeed(new SimpleMeterRegistry(), CLOCK);
  private final RiskStatusService statusService = new RiskStatusService(CLOCK);
  private final TradingControl tradingControl = new TradingControl(CLOCK);
  private final InstrumentCatalog instruments =
      new InstrumentCatalog(List.of(new InstrumentSpec("BTCUSDT", BigDecimal.ONE, BigDecimal.ONE)));

  @Test
  void shouldRaiseOneAlertWhileRiskStaysAboveThreshold() {
    RiskMonitor monitor = monitor(riskOnly("10"), EscalationMode.NONE);
    when(ledger.portfolio())
        .thenReturn(
            riskAt("3"), riskAt("12"), riskAt("14"), riskAt("11"), riskAt("9"));

    for (int i = 0; i < 5; i++) {
      monitor.tick();
    }

    List<Alert> raised = alerts.all();
    assertEquals(1, raised.size());
    assertEquals(RiskRuleId.MAX_RISK, raised.get(0).ruleId());
    assertEquals(AlertSeverity.WARNING, raised.get(0).severity());
  }

  @Test
  void shouldRaiseAgainAfterRuleClears() {
    RiskMonitor monitor = monitor(riskOnly("10"), EscalationMode.NONE);
    when(ledger.portfolio()).thenReturn(riskAt("12"), riskAt("9"), riskAt("12"));

    monitor.tick();
    monitor.tick();
    RiskSnapshot last = monitor.tick();

    assertEquals(2, alerts.all().size());
    assertTrue(last.isBreached(RiskRuleId.MAX_RISK));
    assertEquals(2L, last.trailingAlertCount());
  }

  @Test
  void shouldPublishLatestStatus() {
    RiskMonitor monitor = monitor(riskOnly("10"), EscalationMode.NONE);
    when(ledger.portfolio()).thenReturn(riskAt("12"));

    RiskSnapshot snapshot = monitor.tick();

    RiskStatus status = statusService.latest();
    assertEquals(snapshot, status.snapshot());
    assertEquals(0, new BigDecimal("12").compareTo(snapshot.exposurePercent()));
    assertEquals(0, new BigDecimal("12").compareTo(snapshot.riskPercent()));
    assertEquals(0, new BigDecimal("100").compareTo(snapshot.portfolioValue()));
    assertEquals(1L, status.alertsBySeverity().get(AlertSeverity.WARNING));
    assertFalse(status.tradingHalted());
  }

  @Test
  void shouldHaltAndCancelOnCriticalWhenEscalationEnabled() {
    RiskMonitor monitor = monitor(drawdownOnly("10"), EscalationMode.HALT_AND_CANCEL);
    when(ledger.portfolio()).thenReturn(drawdown("100", "85"));
    when(canceller.cancelAll(anyString())).thenReturn(2);

    RiskSnapshot snapshot = monitor.tick();

    assertTrue(snapshot.isBreached(RiskRuleId.MAX_DRAWDOWN));
    assertTrue(tradingControl.isHalted());
    assertEquals("RISK_ESCALATION:MAX_DRAWDOWN", tradingControl.state().haltReason());
    verify(canceller).cancelAll("RISK_ESCALATION:MAX_DRAWDOWN");
    assertTrue(statusService.latest().tradingHalted());
  }

  @Test
  void shouldOnlyAlertOnCriticalWhenEscalationIsOff() {
    RiskMonitor monitor = monitor(drawdownOnly("10"), EscalationMode.NONE);
    when(ledger.portfolio()).thenReturn(drawdown("100", "85"));

    monitor.tick();

    assertEquals(AlertSeverity.CRITICAL, alerts.all().get(0).severity());
    assertFalse(tradingControl.isHalted());
    verify(canceller, never()).cancelAll(anyString());
  }

  @Test
  void shouldFallBackToStopLossPercentForUnlistedInstruments() {
    RiskLimitConfig limits =
        new RiskLimitConfig(
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            new BigDecimal("5"),
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            RiskAction.REJECT,
            BigDecimal.ZERO);
    RiskMonitor monitor = monitor(limits, EscalationMode.NONE);
    Position eth =
        new Position(
            "ETHUSDT", new BigDecimal("10"), new BigDecimal("5"), BigDecimal.ZERO,
            new BigDecimal("5"), NOW);
    when(ledger.portfolio())
        .thenReturn(view(AggregatePosition.of(new BigDecimal("50"), Map.of("ETHUSDT", eth),
            BigDecimal.ZERO, 1, NOW), "100"));

    RiskSnapshot snapshot = monitor.tick();

    // 50 gross at a 5% stop on a 100 portfolio.
    assertEquals(0, new BigDecimal("2.5").compareTo(snapshot.riskPercent()));
  }

  @Test
  void shouldRaiseTakeProfitWithClosingInstructions() {
    RiskLimitConfig limits =
        RiskLimitConfig.unlimited().withTakeProfitPercent(new BigDecimal("20"));
    RiskMonitor monitor = monitor(limits, EscalationMode.HALT_AND_CANCEL);
    Position longBtc =
        new Position(
            "BTCUSDT", new BigDecimal("2"), new BigDecimal("10"), BigDecimal.ZERO,
            new BigDecimal("12.5"), NOW);
    Position shortEth =
        new Position(
            "ETHUSDT", new BigDecimal("-3"), new BigDecimal("10"), BigDecimal.ZERO,
            new BigDecimal("9.5"), NOW);
    when(ledger.portfolio())
        .thenReturn(view(AggregatePosition.of(new BigDecimal("100"),
            Map.of("BTCUSDT", longBtc, "ETHUSDT", shortEth), BigDecimal.ZERO, 2, NOW), "100"));

    RiskSnapshot snapshot = monitor.tick();

    assertTrue(snapshot.isBreached(RiskRuleId.TAKE_PROFIT));
    Alert alert = alerts.all().get(0);
    assertEquals(AlertSeverity.INFO, alert.severity());
    // the short is only 5% up, under the 20% target
    assertEquals("take profit reached, close SELL BTCUSDT 2", alert.message());
    assertFalse(tradingControl.isHalted());
    verify(canceller, never()).cancelAll(anyString());
  }

  private RiskMonitor monitor(RiskLimitConfig limits, EscalationMode escalation) {
    return new RiskMonitor(
        ledger,
        new RiskLimitConfigHolder(limits),
        instruments,
        alerts,
        statusService,
        tradingControl,
        canceller,
        escalation,
        Duration.ofHours(1),
        CLOCK);
  }

  /** One BTC position whose gross exposure is {@code percent} of a 100 portfolio. */
  private static PortfolioView riskAt(String percent) {
    BigDecimal mark = new BigDecimal(percent);
    Position btc = new Position("BTCUSDT", BigDecimal.ONE, mark, BigDecimal.ZERO, mark, NOW);
    AggregatePosition aggregate =
        AggregatePosition.of(
            new BigDecimal("100").subtract(mark), Map.of("BTCUSDT", btc), BigDecimal.ZERO, 1, NOW);
    return view(aggregate, "100");
  }

  private static PortfolioView drawdown(String peak, String value) {
    return view(
        AggregatePosition.of(new BigDecimal(value), Map.of(), BigDecimal.ZERO, 0, NOW), peak);
  }

  private static PortfolioView view(AggregatePosition aggregate, String peak) {
    return new PortfolioView(aggregate, BigDecimal.ZERO, new BigDecimal(peak));
  }

  private static RiskLimitConfig riskOnly(String maxRiskPercent) {
    return new RiskLimitConfig(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        new BigDecimal(maxRiskPercent),
        RiskAction.REJECT,
        BigDecimal.ZERO);
  }

  private static RiskLimitConfig drawdownOnly(String maxDrawdownPercent) {
    return new RiskLimitConfig(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        new BigDecimal(maxDrawdownPercent),
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        RiskAction.REJECT,
        BigDecimal.ZERO);
  }
}
