package com.execrisk.service.config;

import com.execrisk.domain.risk.RiskAction;
import com.execrisk.domain.risk.RiskLimitConfig;
import com.execrisk.engine.intake.InstrumentSpec;
import com.execrisk.engine.monitor.EscalationMode;
import com.execrisk.engine.scheduler.PacingDefaults;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "execrisk")
public class ExecRiskProperties {
  private BigDecimal initialCash = new BigDecimal("100000");
  private String limitsFile = "";
  private Limits limits = new Limits();
  private List<Instrument> instruments = new ArrayList<>();
  private Scheduler scheduler = new Scheduler();
  private Venue venue = new Venue();
  private Monitor monitor = new Monitor();

  public BigDecimal getInitialCash() {
    return initialCash;
  }

  public void setInitialCash(BigDecimal initialCash) {
    this.initialCash = initialCash;
  }

  public String getLimitsFile() {
    return limitsFile;
  }

  public void setLimitsFile(String limitsFile) {
    this.limitsFile = limitsFile;
  }

  public Limits getLimits() {
    return limits;
  }

  public void setLimits(Limits limits) {
    this.limits = limits;
  }

  public List<Instrument> getInstruments() {
    return instruments;
  }

  public void setInstruments(List<Instrument> instruments) {
    this.instruments = instruments;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public void setScheduler(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  public Venue getVenue() {
    return venue;
  }

  public void setVenue(Venue venue) {
    this.venue = venue;
  }

  public Monitor getMonitor() {
    return monitor;
  }

  public void setMonitor(Monitor monitor) {
    this.monitor = monitor;
  }

  public static class Limits {
    private BigDecimal maxPositionSize = new BigDecimal("10000");
    private BigDecimal maxLoss = new BigDecimal("5000");
    private BigDecimal maxDrawdownPercent = new BigDecimal("10");
    private BigDecimal stopLossPercent = new BigDecimal("5");
    private BigDecimal maxExposurePercent = new BigDecimal("50");
    private BigDecimal maxRiskPercent = new BigDecimal("10");
    private RiskAction stopLossAction = RiskAction.REJECT;
    private BigDecimal takeProfitPercent = BigDecimal.ZERO;

    public RiskLimitConfig toConfig() {
      return new RiskLimitConfig(
          maxPositionSize,
          maxLoss,
          maxDrawdownPercent,
          stopLossPercent,
          maxExposurePercent,
          maxRiskPercent,
          stopLossAction,
          takeProfitPercent);
    }

    public BigDecimal getMaxPositionSize() {
      return maxPositionSize;
    }

    public void setMaxPositionSize(BigDecimal maxPositionSize) {
      this.maxPositionSize = maxPositionSize;
    }

    public BigDecimal getMaxLoss() {
      return maxLoss;
    }

    public void setMaxLoss(BigDecimal maxLoss) {
      this.maxLoss = maxLoss;
    }

    public BigDecimal getMaxDrawdownPercent() {
      return maxDrawdownPercent;
    }

    public void setMaxDrawdownPercent(BigDecimal maxDrawdownPercent) {
      this.maxDrawdownPercent = maxDrawdownPercent;
    }

    public BigDecimal getStopLossPercent() {
      return stopLossPercent;
    }

    public void setStopLossPercent(BigDecimal stopLossPercent) {
      this.stopLossPercent = stopLossPercent;
    }

    public BigDecimal getMaxExposurePercent() {
      return maxExposurePercent;
    }

    public void setMaxExposurePercent(BigDecimal maxExposurePercent) {
      this.maxExposurePercent = maxExposurePercent;
    }

    public BigDecimal getMaxRiskPercent() {
      return maxRiskPercent;
    }

    public void setMaxRiskPercent(BigDecimal maxRiskPercent) {
      this.maxRiskPercent = maxRiskPercent;
    }

    public RiskAction getStopLossAction() {
      return stopLossAction;
    }

    public void setStopLossAction(RiskAction stopLossAction) {
      this.stopLossAction = stopLossAction;
    }

    public BigDecimal getTakeProfitPercent() {
      return takeProfitPercent;
    }

    public void setTakeProfitPercent(BigDecimal takeProfitPercent) {
      this.takeProfitPercent = takeProfitPercent;
    }
  }

  public static class Instrument {
    private String symbol;
    private BigDecimal lotSize = BigDecimal.ONE;
    private BigDecimal stopDistance;
    private BigDecimal referencePrice;

    public InstrumentSpec toSpec() {
      return new InstrumentSpec(symbol, lotSize, stopDistance);
    }

    public String getSymbol() {
      return symbol;
    }

    public void setSymbol(String symbol) {
      this.symbol = symbol;
    }

    public BigDecimal getLotSize() {
      return lotSize;
    }

    public void setLotSize(BigDecimal lotSize) {
      this.lotSize = lotSize;
    }

    public BigDecimal getStopDistance() {
      return stopDistance;
    }

    public void setStopDistance(BigDecimal stopDistance) {
      this.stopDistance = stopDistance;
    }

    /** Mid price the simulated market data starts from; no quote is published when unset. */
    public BigDecimal getReferencePrice() {
      return referencePrice;
    }

    public void setReferencePrice(BigDecimal referencePrice) {
      this.referencePrice = referencePrice;
    }
  }

  public static class Scheduler {
    private int poolSize = 4;
    private Duration shutdownTimeout = Duration.ofSeconds(10);
    private Duration twapHorizon = Duration.ofMinutes(60);
    private int twapSliceCount = 12;
    private Duration vwapHorizon = Duration.ofMinutes(60);
    private List<BigDecimal> vwapCurve = new ArrayList<>(PacingDefaults.standard().vwapCurve());
    private BigDecimal icebergClip = new BigDecimal("100");
    private Duration icebergInterval = Duration.ofSeconds(30);
    private BigDecimal minSlippageClip = new BigDecimal("100");
    private Duration minSlippageInterval = Duration.ofSeconds(10);
    private BigDecimal minSlippageTargetSpreadBps = new BigDecimal("5");

    public PacingDefaults toPacingDefaults() {
      return new PacingDefaults(
          twapHorizon,
          twapSliceCount,
          vwapHorizon,
          vwapCurve,
          icebergClip,
          icebergInterval,
          minSlippageClip,
          minSlippageInterval,
          minSlippageTargetSpreadBps);
    }

    public int getPoolSize() {
      return poolSize;
    }

    public void setPoolSize(int poolSize) {
      this.poolSize = poolSize;
    }

    public Duration getShutdownTimeout() {
      return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = shutdownTimeout;
    }

    public Duration getTwapHorizon() {
      return twapHorizon;
    }

    public void setTwapHorizon(Duration twapHorizon) {
      this.twapHorizon = twapHorizon;
    }

    public int getTwapSliceCount() {
      return twapSliceCount;
    }

    public void setTwapSliceCount(int twapSliceCount) {
      this.twapSliceCount = twapSliceCount;
    }

    public Duration getVwapHorizon() {
      return vwapHorizon;
    }

    public void setVwapHorizon(Duration vwapHorizon) {
      this.vwapHorizon = vwapHorizon;
    }

    public List<BigDecimal> getVwapCurve() {
      return vwapCurve;
    }

    public void setVwapCurve(List<BigDecimal> vwapCurve) {
      this.vwapCurve = vwapCurve;
    }

    public BigDecimal getIcebergClip() {
      return icebergClip;
    }

    public void setIcebergClip(BigDecimal icebergClip) {
      this.icebergClip = icebergClip;
    }

    public Duration getIcebergInterval() {
      return icebergInterval;
    }

    public void setIcebergInterval(Duration icebergInterval) {
      this.icebergInterval = icebergInterval;
    }

    public BigDecimal getMinSlippageClip() {
      return minSlippageClip;
    }

    public void setMinSlippageClip(BigDecimal minSlippageClip) {
      this.minSlippageClip = minSlippageClip;
    }

    public Duration getMinSlippageInterval() {
      return minSlippageInterval;
    }

    public void setMinSlippageInterval(Duration minSlippageInterval) {
      this.minSlippageInterval = minSlippageInterval;
    }

    public BigDecimal getMinSlippageTargetSpreadBps() {
      return minSlippageTargetSpreadBps;
    }

    public void setMinSlippageTargetSpreadBps(BigDecimal minSlippageTargetSpreadBps) {
      this.minSlippageTargetSpreadBps = minSlippageTargetSpreadBps;
    }
  }

  public static class Venue {
    private Retry retry = new Retry();
    private Duration attemptTimeout = Duration.ofSeconds(2);
    private Simulated simulated = new Simulated();

    public Retry getRetry() {
      return retry;
    }

    public void setRetry(Retry retry) {
      this.retry = retry;
    }

    public Duration getAttemptTimeout() {
      return attemptTimeout;
    }

    public void setAttemptTimeout(Duration attemptTimeout) {
      this.attemptTimeout = attemptTimeout;
    }

    public Simulated getSimulated() {
      return simulated;
    }

    public void setSimulated(Simulated simulated) {
      this.simulated = simulated;
    }
  }

  public static class Retry {
    private int maxAttempts = 3;
    private Duration baseBackoff = Duration.ofMillis(250);
    private Duration maxBackoff = Duration.ofSeconds(3);
    private double jitterRatio = 0.2d;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBaseBackoff() {
      return baseBackoff;
    }

    public void setBaseBackoff(Duration baseBackoff) {
      this.baseBackoff = baseBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public double getJitterRatio() {
      return jitterRatio;
    }

    public void setJitterRatio(double jitterRatio) {
      this.jitterRatio = jitterRatio;
    }
  }

  public static class Simulated {
    private Duration fillLatency = Duration.ofMillis(50);
    private int fillsPerOrder = 1;
    private BigDecimal feeBps = BigDecimal.ZERO;
    private BigDecimal spreadBps = new BigDecimal("2");

    public Duration getFillLatency() {
      return fillLatency;
    }

    public void setFillLatency(Duration fillLatency) {
      this.fillLatency = fillLatency;
    }

    public int getFillsPerOrder() {
      return fillsPerOrder;
    }

    public void setFillsPerOrder(int fillsPerOrder) {
      this.fillsPerOrder = fillsPerOrder;
    }

    public BigDecimal getFeeBps() {
      return feeBps;
    }

    public void setFeeBps(BigDecimal feeBps) {
      this.feeBps = feeBps;
    }

    public BigDecimal getSpreadBps() {
      return spreadBps;
    }

    public void setSpreadBps(BigDecimal spreadBps) {
      this.spreadBps = spreadBps;
    }
  }

  public static class Monitor {
    private boolean enabled = true;
    private long fixedRateMs = 1000L;
    private Duration alertWindow = Duration.ofHours(1);
    private EscalationMode escalation = EscalationMode.NONE;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public long getFixedRateMs() {
      return fixedRateMs;
    }

    public void setFixedRateMs(long fixedRateMs) {
      this.fixedRateMs = fixedRateMs;
    }

    public Duration getAlertWindow() {
      return alertWindow;
    }

    public void setAlertWindow(Duration alertWindow) {
      this.alertWindow = alertWindow;
    }

    public EscalationMode getEscalation() {
      return escalation;
    }

    public void setEscalation(EscalationMode escalation) {
      this.escalation = escalation;
    }
  }
}
