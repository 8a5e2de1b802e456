package com.execrisk.engine.monitor;

import com.execrisk.domain.ledger.AggregatePosition;
import com.execrisk.domain.ledger.Position;
import com.execrisk.domain.risk.Alert;
import com.execrisk.domain.risk.AlertSeverity;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.domain.risk.RiskRuleId;
import com.execrisk.domain.risk.RiskSnapshot;
import com.execrisk.engine.intake.InstrumentCatalog;
import com.execrisk.engine.intake.InstrumentSpec;
import com.execrisk.engine.intake.TradingControl;
import com.execrisk.engine.ledger.PortfolioView;
import com.execrisk.engine.ledger.PositionLedger;
import com.execrisk.engine.risk.RiskLimitConfigHolder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic portfolio check. Reads the ledger, compares exposure, risk, drawdown and session loss
 * with the limits, and raises one alert each time a rule goes from clear to breached.
 */
public class RiskMonitor {
  static final String ESCALATION_ACTOR = "risk-monitor";

  /** Reported when the portfolio value is not positive but exposure is still open. */
  static final BigDecimal UNBOUNDED_PERCENT = new BigDecimal("1000000");

  private static final Logger log = LoggerFactory.getLogger(RiskMonitor.class);
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final PositionLedger ledger;
  private final RiskLimitConfigHolder limits;
  private final InstrumentCatalog instruments;
  private final AlertFeed alerts;
  private final RiskStatusService statusService;
  private final TradingControl tradingControl;
  private final ParentOrderCanceller canceller;
  private final EscalationMode escalation;
  private final Duration alertWindow;
  private final Clock clock;
  private final Set<RiskRuleId> breachedLastTick = EnumSet.noneOf(RiskRuleId.class);

  public RiskMonitor(
      PositionLedger ledger,
      RiskLimitConfigHolder limits,
      InstrumentCatalog instruments,
      AlertFeed alerts,
      RiskStatusService statusService,
      TradingControl tradingControl,
      ParentOrderCanceller canceller,
      EscalationMode escalation,
      Duration alertWindow,
      Clock clock) {
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.limits = Objects.requireNonNull(limits, "limits must not be null");
    this.instruments = Objects.requireNonNull(instruments, "instruments must not be null");
    this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
    this.statusService = Objects.requireNonNull(statusService, "statusService must not be null");
    this.tradingControl = Objects.requireNonNull(tradingControl, "tradingControl must not be null");
    this.canceller = Objects.requireNonNull(canceller, "canceller must not be null");
    this.escalation = escalation == null ? EscalationMode.NONE : escalation;
    this.alertWindow = Objects.requireNonNull(alertWindow, "alertWindow must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  public synchronized RiskSnapshot tick() {
    PortfolioView view = ledger.portfolio();
    RiskLimitConfig config = limits.current();
    AggregatePosition aggregate = view.aggregate();
    BigDecimal value = aggregate.portfolioValue();
    Instant now = clock.instant();

    BigDecimal exposurePercent = percentOf(aggregate.grossExposure(), value);
    BigDecimal riskPercent = percentOf(riskAmount(aggregate, config), value);
    BigDecimal drawdownPercent = view.drawdownPercent();
    BigDecimal sessionPnl = view.sessionPnl();

    Set<RiskRuleId> breached = EnumSet.noneOf(RiskRuleId.class);
    if (anyPositionAbove(aggregate, config.maxPositionSize())) {
      breached.add(RiskRuleId.MAX_SIZE);
    }
    if (RiskLimitConfig.isEnabled(config.maxLoss())
        && sessionPnl.compareTo(config.maxLoss().negate()) < 0) {
      breached.add(RiskRuleId.MAX_LOSS);
    }
    if (exceeds(drawdownPercent, config.maxDrawdownPercent())) {
      breached.add(RiskRuleId.MAX_DRAWDOWN);
    }
    if (anyPositionPastStop(aggregate, config.stopLossPercent())) {
      breached.add(RiskRuleId.STOP_LOSS);
    }
    if (exceeds(exposurePercent, config.maxExposurePercent())) {
      breached.add(RiskRuleId.MAX_EXPOSURE);
    }
    if (exceeds(riskPercent, config.maxRiskPercent())) {
      breached.add(RiskRuleId.MAX_RISK);
    }
    List<String> takeProfitTargets = takeProfitTargets(aggregate, config.takeProfitPercent());
    if (!takeProfitTargets.isEmpty()) {
      breached.add(RiskRuleId.TAKE_PROFIT);
    }

    List<Alert> raised = new ArrayList<>();
    for (RiskRuleId ruleId : breached) {
      if (breachedLastTick.contains(ruleId)) {
        continue;
      }
      String message =
          ruleId == RiskRuleId.TAKE_PROFIT
              ? "take profit reached, close " + String.join(", ", takeProfitTargets)
              : message(ruleId, exposurePercent, riskPercent, drawdownPercent, sessionPnl, config);
      raised.add(Alert.raise(ruleId, message, now));
    }
    breachedLastTick.clear();
    breachedLastTick.addAll(breached);
    for (Alert alert : raised) {
      alerts.append(alert);
    }

    RiskSnapshot snapshot =
        new RiskSnapshot(
            exposurePercent,
            riskPercent,
            drawdownPercent,
            sessionPnl,
            value,
            new ArrayList<>(breached),
            alerts.trailingCount(alertWindow),
            now);
    escalate(raised);
    statusService.update(
        new RiskStatus(
            snapshot, alerts.countsBySeverity(alertWindow), tradingControl.isHalted()));
    return snapshot;
  }

  private void escalate(List<Alert> raised) {
    if (escalation != EscalationMode.HALT_AND_CANCEL) {
      return;
    }
    for (Alert alert : raised) {
      if (alert.severity() == AlertSeverity.CRITICAL) {
        String reason = "RISK_ESCALATION:" + alert.ruleId();
        tradingControl.halt(reason, ESCALATION_ACTOR);
        int canceled = canceller.cancelAll(reason);
        log.error(
            "Risk escalation halted trading rule={} canceledParents={}", alert.ruleId(), canceled);
        return;
      }
    }
  }

  private BigDecimal riskAmount(AggregatePosition aggregate, RiskLimitConfig config) {
    BigDecimal fallback = config.stopLossPercent().divide(HUNDRED, 10, RoundingMode.HALF_EVEN);
    BigDecimal total = BigDecimal.ZERO;
    for (Position position : aggregate.positions().values()) {
      BigDecimal distance =
          instruments
              .find(position.instrument())
              .map(InstrumentSpec::stopDistance)
              .orElse(fallback);
      total = total.add(position.grossExposure().multiply(distance));
    }
    return total;
  }

  private static boolean anyPositionAbove(AggregatePosition aggregate, BigDecimal limit) {
    if (!RiskLimitConfig.isEnabled(limit)) {
      return false;
    }
    for (Position position : aggregate.positions().values()) {
      if (position.qty().abs().compareTo(limit) > 0) {
        return true;
      }
    }
    return false;
  }

  private static boolean anyPositionPastStop(AggregatePosition aggregate, BigDecimal limit) {
    if (!RiskLimitConfig.isEnabled(limit)) {
      return false;
    }
    for (Position position : aggregate.positions().values()) {
      if (position.unrealizedLossPercent().compareTo(limit) > 0) {
        return true;
      }
    }
    return false;
  }

  /** Positions at or past the profit target, as "SIDE instrument qty" closing instructions. */
  private static List<String> takeProfitTargets(AggregatePosition aggregate, BigDecimal target) {
    List<String> targets = new ArrayList<>();
    if (!RiskLimitConfig.isEnabled(target)) {
      return targets;
    }
    for (Position position : aggregate.positions().values()) {
      if (!position.isFlat() && position.unrealizedGainPercent().compareTo(target) >= 0) {
        String closingSide = position.qty().signum() > 0 ? "SELL" : "BUY";
        targets.add(
            closingSide
                + " "
                + position.instrument()
                + " "
                + position.qty().abs().stripTrailingZeros().toPlainString());
      }
    }
    targets.sort(null);
    return targets;
  }

  private static boolean exceeds(BigDecimal observed, BigDecimal limit) {
    return RiskLimitConfig.isEnabled(limit) && observed.compareTo(limit) > 0;
  }

  private static BigDecimal percentOf(BigDecimal amount, BigDecimal portfolioValue) {
    if (amount.signum() == 0) {
      return BigDecimal.ZERO;
    }
    if (portfolioValue.signum() <= 0) {
      return UNBOUNDED_PERCENT;
    }
    return amount.multiply(HUNDRED).divide(portfolioValue, 6, RoundingMode.HALF_UP);
  }

  private static String message(
      RiskRuleId ruleId,
      BigDecimal exposurePercent,
      BigDecimal riskPercent,
      BigDecimal drawdownPercent,
      BigDecimal sessionPnl,
      RiskLimitConfig config) {
    if (ruleId == RiskRuleId.MAX_EXPOSURE) {
      return "exposure " + exposurePercent + "% exceeds " + config.maxExposurePercent() + "%";
    }
    if (ruleId == RiskRuleId.MAX_RISK) {
      return "portfolio risk " + riskPercent + "% exceeds " + config.maxRiskPercent() + "%";
    }
    if (ruleId == RiskRuleId.MAX_DRAWDOWN) {
      return "drawdown " + drawdownPercent + "% exceeds " + config.maxDrawdownPercent() + "%";
    }
    if (ruleId == RiskRuleId.MAX_LOSS) {
      return "session pnl " + sessionPnl + " is below -" + config.maxLoss();
    }
    if (ruleId == RiskRuleId.STOP_LOSS) {
      return "a position is down more than " + config.stopLossPercent() + "% from cost";
    }
    return "a position exceeds max size " + config.maxPositionSize();
  }
}
