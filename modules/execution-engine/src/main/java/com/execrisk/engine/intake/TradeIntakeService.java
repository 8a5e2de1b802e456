package com.execrisk.engine.intake;

import com.execrisk.domain.orders.OrderDomainException;
import com.execrisk.domain.orders.OrderIntent;
import com.execrisk.domain.risk.RiskDecision;
import com.execrisk.engine.risk.PreTradeRiskService;
import com.execrisk.engine.risk.RiskRejectedException;
import com.execrisk.engine.scheduler.ExecutionScheduler;
import com.execrisk.engine.scheduler.Lots;
import com.execrisk.engine.scheduler.PacingDefaults;
import com.execrisk.engine.scheduler.PacingStrategy;
import com.execrisk.integration.venue.MarketDataProvider;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for new orders: validate, check the halt flag, run the full-size risk check, then
 * hand the parent to the scheduler. Every failure is synchronous; the terminal status of an
 * accepted order arrives later through the execution status listeners.
 */
public class TradeIntakeService {
  private static final Logger log = LoggerFactory.getLogger(TradeIntakeService.class);

  private final InstrumentCatalog instruments;
  private final PacingDefaults pacingDefaults;
  private final MarketDataProvider marketData;
  private final TradingControl tradingControl;
  private final PreTradeRiskService riskService;
  private final ExecutionScheduler scheduler;
  private final Clock clock;

  public TradeIntakeService(
      InstrumentCatalog instruments,
      PacingDefaults pacingDefaults,
      MarketDataProvider marketData,
      TradingControl tradingControl,
      PreTradeRiskService riskService,
      ExecutionScheduler scheduler,
      Clock clock) {
    this.instruments = Objects.requireNonNull(instruments, "instruments must not be null");
    this.pacingDefaults = Objects.requireNonNull(pacingDefaults, "pacingDefaults must not be null");
    this.marketData = Objects.requireNonNull(marketData, "marketData must not be null");
    this.tradingControl = Objects.requireNonNull(tradingControl, "tradingControl must not be null");
    this.riskService = Objects.requireNonNull(riskService, "riskService must not be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public IntakeResult submit(TradeRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    OrderIntent intent;
    try {
      intent = request.toIntent(clock.instant());
    } catch (OrderDomainException ex) {
      throw new IntentValidationException(ex.code(), ex.getMessage());
    }
    return submit(intent);
  }

  public IntakeResult submit(OrderIntent intent) {
    Objects.requireNonNull(intent, "intent must not be null");
    PacingStrategy strategy = validate(intent);

    if (tradingControl.isHalted()) {
      log.info(
          "Intake refused while halted orderId={} instrument={} reason={}",
          intent.id(),
          intent.instrument(),
          tradingControl.state().haltReason());
      throw new TradingHaltedException(tradingControl.state().haltReason());
    }

    RiskDecision decision =
        riskService.check(intent.instrument(), intent.side(), intent.qty(), intent.limitPrice());
    if (!decision.accepted()) {
      throw new RiskRejectedException(decision);
    }

    scheduler.start(intent, strategy);
    log.info(
        "Order accepted orderId={} instrument={} side={} qty={} algorithm={}",
        intent.id(),
        intent.instrument(),
        intent.side(),
        intent.qty(),
        intent.algorithm());
    return new IntakeResult(intent.id(), true);
  }

  private PacingStrategy validate(OrderIntent intent) {
    InstrumentSpec spec =
        instruments
            .find(intent.instrument())
            .orElseThrow(
                () ->
                    new IntentValidationException(
                        IntentValidationException.UNKNOWN_INSTRUMENT,
                        "unknown instrument " + intent.instrument()));
    if (!Lots.isAligned(intent.qty(), spec.lotSize())) {
      throw new IntentValidationException(
          OrderIntent.QTY_LOT_MISMATCH,
          "qty " + intent.qty() + " is not a multiple of lot " + spec.lotSize());
    }
    try {
      PacingStrategy strategy =
          PacingStrategy.forIntent(intent, spec.lotSize(), pacingDefaults, marketData);
      strategy.requireSchedulable(intent);
      return strategy;
    } catch (OrderDomainException ex) {
      throw new IntentValidationException(ex.code(), ex.getMessage());
    }
  }
}
