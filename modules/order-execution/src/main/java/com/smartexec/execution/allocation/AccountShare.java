package com.smartexec.execution.allocation;

import java.math.BigDecimal;
import java.util.Objects;

/** Requested share of a fill for one account, as a percentage of the filled quantity. */
public record AccountShare(String account, BigDecimal percentage) {
  public AccountShare {
    Objects.requireNonNull(account, "account must not be null");
    Objects.requireNonNull(percentage, "percentage must not be null");
    if (percentage.signum() < 0) {
      throw new IllegalArgumentException("percentage must be >= 0");
    }
  }
}
