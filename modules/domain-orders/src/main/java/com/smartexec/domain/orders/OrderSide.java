package com.smartexec.domain.orders;

public enum OrderSide {
  BUY,
  SELL,
  SELL_SHORT;

  public boolean isBuy() {
    return this == BUY;
  }
}
