package com.execrisk.engine.risk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.execrisk.domain.ledger.Fill;
import com.execrisk.domain.orders.ChildOrderSlice;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.orders.PacingAlgorithm;
import com.execrisk.domain.orders.PacingParameters;
import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.domain.risk.RiskEvaluationContext;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.domain.risk.RiskRuleEngine;
import com.execrisk.domain.risk.RiskRuleId;
import com.execrisk.engine.ledger.InMemoryLedgerJournal;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.integration.venue.SimulatedMarketData;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PreTradeRiskServiceTest {
  private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final PositionLedger ledger =
      new PositionLedger(new BigDecimal("100000"), new InMemoryLedgerJournal(), registry, CLOCK);
  private final SimulatedMarketData marketData = new SimulatedMarketData(CLOCK);
  private final RiskLimitConfigHolder limits =
      new RiskLimitConfigHolder(
          RiskLimitConfig.unlimited().withMaxPositionSize(new BigDecimal("500")));
  private final PreTradeRiskService service =
      new PreTradeRiskService(
          RiskRuleEngine.standard(), limits, ledger, marketData, registry, CLOCK);

  @Test
  void shouldRejectOrderAboveMaxSize() {
    RiskDecision decision = service.check("BTCUSDT", OrderSide.BUY, new BigDecimal("600"), null);

    assertFalse(decision.accepted());
    assertTrue(decision.violated(RiskRuleId.MAX_SIZE));
    assertEquals(
        1.0d, registry.get("risk.evaluations").tag("decision", "rejected").counter().count());
  }

  @Test
  void shouldCountScheduledButUnfilledQtyInSliceCheck() {
    OrderIntent parent = intent("1000");

    RiskDecision rejected =
        service.checkSlice(
            parent.id(),
            "BTCUSDT",
            OrderSide.BUY,
            new BigDecimal("400"),
            new BigDecimal("200"),
            null);
    assertTrue(rejected.violated(RiskRuleId.MAX_SIZE));

    ChildOrderSlice first = ChildOrderSlice.createNew(parent, 0, new BigDecimal("400"), NOW);
    ledger.registerSlice(first);
    ledger.applyFill(
        new Fill(
            "T-1",
            first.id(),
            parent.id(),
            "BTCUSDT",
            OrderSide.BUY,
            new BigDecimal("400"),
            new BigDecimal("10"),
            BigDecimal.ZERO,
            NOW));

    RiskDecision accepted =
        service.checkSlice(
            parent.id(),
            "BTCUSDT",
            OrderSide.BUY,
            new BigDecimal("400"),
            new BigDecimal("100"),
            null);
    assertTrue(accepted.accepted());
  }

  @Test
  void shouldUseLimitsInForceAtEvaluationTime() {
    assertFalse(service.check("BTCUSDT", OrderSide.BUY, new BigDecimal("600"), null).accepted());

    limits.reconfigure(RiskLimitConfig.unlimited().withMaxPositionSize(new BigDecimal("1000")));

    assertTrue(service.check("BTCUSDT", OrderSide.BUY, new BigDecimal("600"), null).accepted());
  }

  @Test
  void shouldPriceProposalFromQuoteMidBeforeLimitPrice() {
    List<RiskEvaluationContext> contexts = new ArrayList<>();
    service.addListener((context, decision) -> contexts.add(context));

    service.check("BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("90"));
    marketData.publish("BTCUSDT", new BigDecimal("99"), new BigDecimal("101"));
    service.check("BTCUSDT", OrderSide.BUY, BigDecimal.ONE, new BigDecimal("90"));

    assertEquals(0, new BigDecimal("90").compareTo(contexts.get(0).referencePrice()));
    assertEquals(0, new BigDecimal("100").compareTo(contexts.get(1).referencePrice()));
  }

  private static OrderIntent intent(String qty) {
    return OrderIntent.create(
        "BTCUSDT",
        OrderSide.BUY,
        new BigDecimal(qty),
        PacingAlgorithm.ICEBERG,
        PacingParameters.none(),
        NOW);
  }
}
