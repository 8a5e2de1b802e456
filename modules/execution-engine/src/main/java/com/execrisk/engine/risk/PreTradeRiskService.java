package com.execrisk.engine.risk;

import com.execrisk.domain.orders.OrderSide;
import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.domain.risk.RiskEvaluationContext;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.domain.risk.RiskRuleEngine;
import com.execrisk.engine.ledger.LedgerView;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.integration.venue.MarketDataProvider;
import com.execrisk.integration.venue.Quote;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a risk context from the ledger and the current limits and runs the rule engine. Both the
 * intake path and the scheduler go through here, so no order reaches a venue unchecked.
 */
public class PreTradeRiskService {
  static final String EVALUATIONS_COUNTER = "risk.evaluations";

  private static final Logger log = LoggerFactory.getLogger(PreTradeRiskService.class);

  private final RiskRuleEngine ruleEngine;
  private final RiskLimitConfigHolder limits;
  private final PositionLedger ledger;
  private final MarketDataProvider marketData;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final List<RiskDecisionListener> listeners = new CopyOnWriteArrayList<>();

  public PreTradeRiskService(
      RiskRuleEngine ruleEngine,
      RiskLimitConfigHolder limits,
      PositionLedger ledger,
      MarketDataProvider marketData,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
    this.limits = Objects.requireNonNull(limits, "limits must not be null");
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.marketData = Objects.requireNonNull(marketData, "marketData must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public void addListener(RiskDecisionListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
  }

  /** Checks a whole new order against the ledger as it stands. */
  public RiskDecision check(
      String instrument, OrderSide side, BigDecimal qty, BigDecimal limitPrice) {
    LedgerView view = ledger.view(instrument, null);
    return evaluate(instrument, side, qty, limitPrice, view);
  }

  /**
   * Checks the next slice of a working parent. The proposed change is everything already
   * scheduled for the parent that has not filled yet, plus this slice.
   */
  public RiskDecision checkSlice(
      UUID parentId,
      String instrument,
      OrderSide side,
      BigDecimal scheduledQty,
      BigDecimal sliceQty,
      BigDecimal limitPrice) {
    Objects.requireNonNull(parentId, "parentId must not be null");
    LedgerView view = ledger.view(instrument, parentId);
    BigDecimal unfilled = scheduledQty.subtract(view.parentFilledQty()).max(BigDecimal.ZERO);
    BigDecimal proposed = unfilled.add(sliceQty);
    return evaluate(instrument, side, proposed, limitPrice, view);
  }

  private RiskDecision evaluate(
      String instrument,
      OrderSide side,
      BigDecimal qty,
      BigDecimal limitPrice,
      LedgerView view) {
    RiskLimitConfig config = limits.current();
    RiskEvaluationContext context =
        new RiskEvaluationContext(
            instrument,
            side,
            qty,
            referencePrice(instrument, limitPrice),
            view.position(),
            view.portfolio().aggregate(),
            config,
            view.portfolio().sessionBaselinePnl(),
            view.portfolio().peakPortfolioValue(),
            clock.instant());
    RiskDecision decision = ruleEngine.evaluate(context);
    meterRegistry
        .counter(EVALUATIONS_COUNTER, "decision", decision.accepted() ? "accepted" : "rejected")
        .increment();
    if (!decision.accepted()) {
      log.info(
          "Pre-trade risk rejected instrument={} side={} qty={} violations={}",
          instrument,
          side,
          qty,
          decision.summary());
    }
    for (RiskDecisionListener listener : listeners) {
      try {
        listener.onDecision(context, decision);
      } catch (RuntimeException ex) {
        log.warn("Risk decision listener failed instrument={} side={}", instrument, side, ex);
      }
    }
    return decision;
  }

  private BigDecimal referencePrice(String instrument, BigDecimal limitPrice) {
    return marketData.latestQuote(instrument).map(Quote::mid).orElse(limitPrice);
  }
}
