package com.execrisk.domain.risk;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Risk thresholds. A threshold of zero disables the rule that reads it. {@code takeProfitPercent}
 * is only watched by the monitor; it never blocks an order.
 */
public record RiskLimitConfig(
    BigDecimal maxPositionSize,
    BigDecimal maxLoss,
    BigDecimal maxDrawdownPercent,
    BigDecimal stopLossPercent,
    BigDecimal maxExposurePercent,
    BigDecimal maxRiskPercent,
    RiskAction stopLossAction,
    BigDecimal takeProfitPercent) {

  public RiskLimitConfig {
    maxPositionSize = requireNonNegative(maxPositionSize, "maxPositionSize");
    maxLoss = requireNonNegative(maxLoss, "maxLoss");
    maxDrawdownPercent = requireNonNegative(maxDrawdownPercent, "maxDrawdownPercent");
    stopLossPercent = requireNonNegative(stopLossPercent, "stopLossPercent");
    maxExposurePercent = requireNonNegative(maxExposurePercent, "maxExposurePercent");
    maxRiskPercent = requireNonNegative(maxRiskPercent, "maxRiskPercent");
    stopLossAction = stopLossAction == null ? RiskAction.REJECT : stopLossAction;
    takeProfitPercent =
        requireNonNegative(
            takeProfitPercent == null ? BigDecimal.ZERO : takeProfitPercent, "takeProfitPercent");
  }

  public static RiskLimitConfig defaults() {
    return new RiskLimitConfig(
        new BigDecimal("10000"),
        new BigDecimal("5000"),
        new BigDecimal("10"),
        new BigDecimal("5"),
        new BigDecimal("50"),
        new BigDecimal("10"),
        RiskAction.REJECT,
        BigDecimal.ZERO);
  }

  public static RiskLimitConfig unlimited() {
    return new RiskLimitConfig(
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        RiskAction.REJECT,
        BigDecimal.ZERO);
  }

  public RiskLimitConfig withMaxPositionSize(BigDecimal value) {
    return new RiskLimitConfig(
        value,
        maxLoss,
        maxDrawdownPercent,
        stopLossPercent,
        maxExposurePercent,
        maxRiskPercent,
        stopLossAction,
        takeProfitPercent);
  }

  public RiskLimitConfig withTakeProfitPercent(BigDecimal value) {
    return new RiskLimitConfig(
        maxPositionSize,
        maxLoss,
        maxDrawdownPercent,
        stopLossPercent,
        maxExposurePercent,
        maxRiskPercent,
        stopLossAction,
        value);
  }

  public static boolean isEnabled(BigDecimal threshold) {
    return threshold.signum() > 0;
  }

  private static BigDecimal requireNonNegative(BigDecimal value, String fieldName) {
    Objects.requireNonNull(value, fieldName + " must not be null");
    if (value.signum() < 0) {
      throw new IllegalArgumentException(fieldName + " must be >= 0");
    }
    return value;
  }
}
