package com.smartexec.domain.orders;

public enum TimeInForce {
  DAY,
  GTC,
  IOC,
  FOK,
  GTD
}
