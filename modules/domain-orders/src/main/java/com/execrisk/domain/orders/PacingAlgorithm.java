package com.execrisk.domain.orders;

public enum PacingAlgorithm {
  TWAP,
  VWAP,
  ICEBERG,
  MIN_SLIPPAGE
}
