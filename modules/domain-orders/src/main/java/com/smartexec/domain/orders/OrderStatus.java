package com.smartexec.domain.orders;

public enum OrderStatus {
  PENDING,
  NEW,
  PARTIALLY_FILLED,
  FILLED,
  PENDING_CANCEL,
  CANCELED,
  PENDING_REPLACE,
  REPLACED,
  REJECTED,
  EXPIRED;

  public boolean isTerminal() {
    return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
  }

  /** States in which venue fills may still be applied. */
  public boolean isFillable() {
    return this == NEW
        || this == PARTIALLY_FILLED
        || this == PENDING_REPLACE
        || this == PENDING_CANCEL;
  }

  /** States in which new venue activity may start; a pending cancel only drains. */
  public boolean isDispatchable() {
    return this == NEW || this == PARTIALLY_FILLED || this == PENDING_REPLACE;
  }

  public boolean isWorking() {
    return this == NEW || this == PARTIALLY_FILLED;
  }
}
