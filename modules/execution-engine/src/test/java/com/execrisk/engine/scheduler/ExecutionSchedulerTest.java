package com.execrisk.engine.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import com.execrisk.domain.orders.ParentOrderStatus;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.domain.risk.RiskRuleEngine;
import com.execrisk.engine.ledger.InMemoryLedgerJournal;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.lifecycle.OrderLifecycleEngine;
import com.execrisk.engine.risk.PreTradeRiskService;
import com.execrisk.engine.risk.RiskLimitConfigHolder;
import com.execrisk.integration.venue.JitteredExponentialBackoff;
import com.execrisk.integration.venue.SimulatedMarketData;
import com.execrisk.integration.venue.VenueRetryExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutionSchedulerTest {
  private final Clock clock = Clock.systemUTC();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final List<String> events = new CopyOnWriteArrayList<>();
  private final ScriptedVenue venue = new ScriptedVenue(events);
  private final PositionLedger ledger =
      new PositionLedger(new BigDecimal("1000000"), new InMemoryLedgerJournal(), registry, clock);
  private final SimulatedMarketData marketData = new SimulatedMarketData(clock);
  private final RiskLimitConfigHolder limits =
      new RiskLimitConfigHolder(RiskLimitConfig.unlimited());
  private final PreTradeRiskService riskService =
      new PreTradeRiskService(
          RiskRuleEngine.standard(),
          limits,
          ledger,
          marketData,
          registry,
          clock);
  private final OrderLifecycleEngine lifecycle =
      new OrderLifecycleEngine(
          venue,
          new VenueRetryExecutor(
              3, JitteredExponentialBackoff.none(), Duration.ZERO, null, wait -> {}, registry),
          ledger,
          registry,
          clock);
  private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();
  private final ExecutionScheduler scheduler =
      new ExecutionScheduler(
          executor, riskService, lifecycle, ledger, marketData, registry, clock);

  ExecutionSchedulerTest() {
    lifecycle.addListener(scheduler);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldFillTwapParentAndNotifyListeners() throws Exception {
    List<ExecutionReport> reports = new CopyOnWriteArrayList<>();
    scheduler.addListener(reports::add);
    OrderIntent intent = intent("1000", PacingAlgorithm.TWAP);

    ExecutionReport report =
        scheduler
            .start(intent, new TwapStrategy(Duration.ZERO, 7, BigDecimal.ONE))
            .get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.FILLED, report.status());
    assertEquals(7, report.slicesEmitted());
    assertEquals(0, new BigDecimal("1000").compareTo(report.filledQty()));
    assertEquals(0, new BigDecimal("1000").compareTo(ledger.snapshot("BTCUSDT").qty()));
    assertEquals(List.of(report), reports);
    assertEquals(7.0d, registry.get("execution.slices.emitted").counter().count());
    assertEquals(
        1.0d,
        registry.get("execution.parents.completed").tag("status", "FILLED").counter().count());
    assertEquals(ParentOrderStatus.FILLED, scheduler.status(intent.id()).orElseThrow().status());
    assertTrue(report.slippageBps().isEmpty());
  }

  @Test
  void shouldReportSlippageAgainstArrivalMid() throws Exception {
    marketData.publish("BTCUSDT", new BigDecimal("79.9"), new BigDecimal("80.1"));
    OrderIntent intent = intent("300", PacingAlgorithm.ICEBERG);

    ExecutionReport report =
        scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    // every clip fills at 100 on the scripted venue
    assertEquals(0, new BigDecimal("80").compareTo(report.arrivalMid()));
    assertEquals(0, new BigDecimal("100").compareTo(report.avgFillPrice()));
    assertEquals(0, new BigDecimal("2500").compareTo(report.slippageBps().orElseThrow()));
  }

  @Test
  void shouldStopIcebergWhenSliceExhaustsRetries() throws Exception {
    venue.failingOrders.add(3);
    OrderIntent intent = intent("500", PacingAlgorithm.ICEBERG);

    ExecutionReport report =
        scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.PARTIALLY_EXECUTED, report.status());
    assertEquals(0, new BigDecimal("200").compareTo(report.filledQty()));
    assertEquals(0, new BigDecimal("200").compareTo(ledger.snapshot("BTCUSDT").qty()));
    assertEquals(3, report.slicesEmitted());
    assertEquals(3, venue.distinctOrders());
    assertEquals(5, venue.requests.size());
    assertTrue(report.reason().contains("RETRIES_EXHAUSTED"));
  }

  @Test
  void shouldCheckRiskAgainstCurrentPositionBeforeEverySubmission() throws Exception {
    riskService.addListener(
        (context, decision) -> events.add("risk:" + context.position().qty().toPlainString()));
    OrderIntent intent = intent("300", PacingAlgorithm.ICEBERG);

    scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    assertEquals(
        List.of("risk:0", "submit:100", "risk:100", "submit:100", "risk:200", "submit:100"),
        events);
  }

  @Test
  void shouldHaltRemainingSlicesWhenRiskRejects() throws Exception {
    limits.reconfigure(RiskLimitConfig.unlimited().withMaxPositionSize(new BigDecimal("250")));
    OrderIntent intent = intent("500", PacingAlgorithm.ICEBERG);

    ExecutionReport report =
        scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.PARTIALLY_EXECUTED, report.status());
    assertEquals(0, new BigDecimal("200").compareTo(report.scheduledQty()));
    assertTrue(report.reason().startsWith("RISK_REJECTED"));
    assertEquals(2, venue.requests.size());
  }

  @Test
  void shouldReportPartialExecutionWhenVenueRejects() throws Exception {
    venue.rejectedOrders.add(2);
    OrderIntent intent = intent("300", PacingAlgorithm.ICEBERG);

    ExecutionReport report =
        scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.PARTIALLY_EXECUTED, report.status());
    assertEquals(0, new BigDecimal("100").compareTo(report.filledQty()));
    assertTrue(report.reason().startsWith("VENUE_REJECTED"));
  }

  @Test
  void shouldCancelBetweenSlices() throws Exception {
    OrderIntent intent = intent("300", PacingAlgorithm.ICEBERG);
    CompletableFuture<ExecutionReport> completion =
        scheduler.start(intent, clipsOf100(Duration.ofHours(1)));
    awaitFilled(intent, new BigDecimal("100"));

    assertTrue(scheduler.cancel(intent.id(), "USER_REQUEST"));
    ExecutionReport report = completion.get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.CANCELED, report.status());
    assertEquals(1, report.slicesEmitted());
    assertEquals("USER_REQUEST", report.reason());
    assertEquals(1, venue.requests.size());
    assertTrue(scheduler.activeParents().isEmpty());
  }

  @Test
  void shouldFailParentOnLedgerInconsistency() throws Exception {
    venue.overfill = true;
    OrderIntent intent = intent("200", PacingAlgorithm.ICEBERG);

    ExecutionReport report =
        scheduler.start(intent, clipsOf100(Duration.ZERO)).get(5, TimeUnit.SECONDS);

    assertEquals(ParentOrderStatus.FAILED, report.status());
    assertTrue(report.reason().startsWith("LEDGER_INCONSISTENCY"));
    assertTrue(ledger.snapshot("BTCUSDT").isFlat());
    assertEquals(1, venue.requests.size());
  }

  private void awaitFilled(OrderIntent intent, BigDecimal expected) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (ledger.parentFilledQty(intent.id()).compareTo(expected) < 0) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("parent " + intent.id() + " never reached " + expected);
      }
      Thread.sleep(10);
    }
  }

  private static OrderIntent intent(String qty, PacingAlgorithm algorithm) {
    return OrderIntent.create(
        "BTCUSDT",
        OrderSide.BUY,
        new BigDecimal(qty),
        algorithm,
        PacingParameters.none(),
        Instant.now());
  }

  private static IcebergStrategy clipsOf100(Duration interval) {
    return new IcebergStrategy(new BigDecimal("100"), interval, BigDecimal.ONE);
  }
}
