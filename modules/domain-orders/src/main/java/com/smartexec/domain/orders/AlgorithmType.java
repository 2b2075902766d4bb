package com.smartexec.domain.orders;

public enum AlgorithmType {
  TWAP,
  VWAP,
  POV,
  ICEBERG
}
