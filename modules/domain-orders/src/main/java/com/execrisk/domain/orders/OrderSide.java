package com.execrisk.domain.orders;

import java.math.BigDecimal;

public enum OrderSide {
  BUY,
  SELL;

  public BigDecimal signed(BigDecimal qty) {
    return this == BUY ? qty : qty.negate();
  }

  public OrderSide opposite() {
    return this == BUY ? SELL : BUY;
  }

  public static OrderSide closing(BigDecimal positionQty) {
    return positionQty.signum() >= 0 ? SELL : BUY;
  }
}
