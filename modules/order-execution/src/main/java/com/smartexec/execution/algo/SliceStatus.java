package com.smartexec.execution.algo;

public enum SliceStatus {
  PENDING,
  ACTIVE,
  FILLED,
  CANCELED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED;
  }
}
