package com.execrisk.service.config;

import com.execrisk.domain.risk.RiskRuleEngine;
import com.execrisk.engine.intake.InstrumentCatalog;
import com.execrisk.engine.intake.InstrumentSpec;
import com.execrisk.engine.intake.TradeIntakeService;
import com.execrisk.engine.intake.TradingControl;
import com.execrisk.engine.ledger.InMemoryLedgerJournal;
import com.execrisk.engine.ledger.LedgerJournal;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.ledger.PositionMarker;
import com.execrisk.engine.lifecycle.OrderLifecycleEngine;
import com.execrisk.engine.monitor.AlertFeed;
import com.execrisk.engine.monitor.LedgerInconsistencyAlerts;
import com.execrisk.engine.monitor.RiskMonitor;
import com.execrisk.engine.monitor.RiskStatusService;
import com.execrisk.engine.risk.PreTradeRiskService;
import com.execrisk.engine.risk.RiskLimitConfigHolder;
import com.execrisk.engine.scheduler.ExecutionScheduler;
import com.execrisk.engine.scheduler.PacingDefaults;
import com.execrisk.integration.venue.JitteredExponentialBackoff;
import com.execrisk.integration.venue.MarketDataProvider;
import com.execrisk.integration.venue.SimulatedMarketData;
import com.execrisk.integration.venue.SimulatedVenueGateway;
import com.execrisk.integration.venue.VenueGateway;
import com.execrisk.integration.venue.VenueRetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ExecRiskProperties.class)
public class EngineConfiguration {
  private static final BigDecimal TWO = BigDecimal.valueOf(2);
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  @Bean
  @ConditionalOnMissingBean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  EngineExecutors engineExecutors(ExecRiskProperties properties) {
    return new EngineExecutors(properties.getScheduler().getPoolSize());
  }

  @Bean
  RiskLimitConfigHolder riskLimitConfigHolder(ExecRiskProperties properties) {
    return new RiskLimitConfigHolder(properties.getLimits().toConfig());
  }

  @Bean
  InstrumentCatalog instrumentCatalog(ExecRiskProperties properties) {
    List<InstrumentSpec> specs = new ArrayList<>();
    for (ExecRiskProperties.Instrument instrument : properties.getInstruments()) {
      specs.add(instrument.toSpec());
    }
    return new InstrumentCatalog(specs);
  }

  @Bean
  PacingDefaults pacingDefaults(ExecRiskProperties properties) {
    return properties.getScheduler().toPacingDefaults();
  }

  @Bean
  @ConditionalOnMissingBean
  LedgerJournal ledgerJournal() {
    return new InMemoryLedgerJournal();
  }

  @Bean
  PositionLedger positionLedger(
      ExecRiskProperties properties,
      LedgerJournal journal,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new PositionLedger(properties.getInitialCash(), journal, meterRegistry, clock);
  }

  @Bean
  @ConditionalOnMissingBean(MarketDataProvider.class)
  SimulatedMarketData simulatedMarketData(ExecRiskProperties properties, Clock clock) {
    SimulatedMarketData marketData = new SimulatedMarketData(clock);
    BigDecimal spreadBps = properties.getVenue().getSimulated().getSpreadBps();
    for (ExecRiskProperties.Instrument instrument : properties.getInstruments()) {
      BigDecimal mid = instrument.getReferencePrice();
      if (mid == null) {
        continue;
      }
      BigDecimal halfSpread =
          mid.multiply(spreadBps).divide(BPS.multiply(TWO), 10, RoundingMode.HALF_UP);
      marketData.publish(instrument.getSymbol(), mid.subtract(halfSpread), mid.add(halfSpread));
    }
    return marketData;
  }

  @Bean
  @ConditionalOnMissingBean(VenueGateway.class)
  SimulatedVenueGateway simulatedVenueGateway(
      ExecRiskProperties properties,
      MarketDataProvider marketData,
      EngineExecutors executors,
      Clock clock) {
    ExecRiskProperties.Simulated simulated = properties.getVenue().getSimulated();
    return new SimulatedVenueGateway(
        marketData,
        executors.venueFills(),
        simulated.getFillLatency(),
        simulated.getFillsPerOrder(),
        simulated.getFeeBps(),
        clock);
  }

  @Bean
  VenueRetryExecutor venueRetryExecutor(
      ExecRiskProperties properties, EngineExecutors executors, MeterRegistry meterRegistry) {
    ExecRiskProperties.Retry retry = properties.getVenue().getRetry();
    return new VenueRetryExecutor(
        retry.getMaxAttempts(),
        new JitteredExponentialBackoff(
            retry.getBaseBackoff(), retry.getMaxBackoff(), retry.getJitterRatio()),
        properties.getVenue().getAttemptTimeout(),
        executors.venueAttempts(),
        meterRegistry);
  }

  @Bean
  PositionMarker positionMarker(PositionLedger ledger, MarketDataProvider marketData) {
    return new PositionMarker(ledger, marketData);
  }

  @Bean
  PreTradeRiskService preTradeRiskService(
      RiskLimitConfigHolder limits,
      PositionLedger ledger,
      MarketDataProvider marketData,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new PreTradeRiskService(
        RiskRuleEngine.standard(), limits, ledger, marketData, meterRegistry, clock);
  }

  @Bean
  OrderLifecycleEngine orderLifecycleEngine(
      VenueGateway venue,
      VenueRetryExecutor retryExecutor,
      PositionLedger ledger,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new OrderLifecycleEngine(venue, retryExecutor, ledger, meterRegistry, clock);
  }

  @Bean(destroyMethod = "")
  ExecutionScheduler executionScheduler(
      EngineExecutors executors,
      PreTradeRiskService riskService,
      OrderLifecycleEngine lifecycle,
      PositionLedger ledger,
      MarketDataProvider marketData,
      MeterRegistry meterRegistry,
      Clock clock) {
    ExecutionScheduler scheduler =
        new ExecutionScheduler(
            executors.slicePacing(),
            riskService,
            lifecycle,
            ledger,
            marketData,
            meterRegistry,
            clock);
    lifecycle.addListener(scheduler);
    return scheduler;
  }

  @Bean
  ExecutionSchedulerShutdown executionSchedulerShutdown(
      ExecutionScheduler scheduler, ExecRiskProperties properties) {
    return new ExecutionSchedulerShutdown(
        scheduler, properties.getScheduler().getShutdownTimeout());
  }

  @Bean
  TradingControl tradingControl(Clock clock) {
    return new TradingControl(clock);
  }

  @Bean
  AlertFeed alertFeed(MeterRegistry meterRegistry, Clock clock) {
    return new AlertFeed(meterRegistry, clock);
  }

  @Bean
  LedgerInconsistencyAlerts ledgerInconsistencyAlerts(
      AlertFeed alerts, OrderLifecycleEngine lifecycle, Clock clock) {
    LedgerInconsistencyAlerts listener = new LedgerInconsistencyAlerts(alerts, clock);
    lifecycle.addListener(listener);
    return listener;
  }

  @Bean
  RiskStatusService riskStatusService(Clock clock) {
    return new RiskStatusService(clock);
  }

  @Bean
  RiskMonitor riskMonitor(
      PositionLedger ledger,
      RiskLimitConfigHolder limits,
      InstrumentCatalog instruments,
      AlertFeed alerts,
      RiskStatusService statusService,
      TradingControl tradingControl,
      ExecutionScheduler scheduler,
      ExecRiskProperties properties,
      Clock clock) {
    ExecRiskProperties.Monitor monitor = properties.getMonitor();
    return new RiskMonitor(
        ledger,
        limits,
        instruments,
        alerts,
        statusService,
        tradingControl,
        scheduler::cancelAll,
        monitor.getEscalation(),
        monitor.getAlertWindow(),
        clock);
  }

  @Bean
  TradeIntakeService tradeIntakeService(
      InstrumentCatalog instruments,
      PacingDefaults pacingDefaults,
      MarketDataProvider marketData,
      TradingControl tradingControl,
      PreTradeRiskService riskService,
      ExecutionScheduler scheduler,
      Clock clock) {
    return new TradeIntakeService(
        instruments, pacingDefaults, marketData, tradingControl, riskService, scheduler, clock);
  }
}
