package com.smartexec.execution.algo;

public enum AlgoState {
  RUNNING,
  PAUSED,
  COMPLETED,
  CANCELED
}
