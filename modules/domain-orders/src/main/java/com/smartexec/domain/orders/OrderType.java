package com.smartexec.domain.orders;

public enum OrderType {
  MARKET,
  LIMIT,
  STOP,
  STOP_LIMIT;

  public boolean requiresLimitPrice() {
    return this == LIMIT || this == STOP_LIMIT;
  }

  public boolean requiresStopPrice() {
    return this == STOP || this == STOP_LIMIT;
  }
}
