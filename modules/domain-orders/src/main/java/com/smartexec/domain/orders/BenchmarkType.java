package com.smartexec.domain.orders;

public enum BenchmarkType {
  ARRIVAL_PRICE,
  MARKET_VWAP
}
