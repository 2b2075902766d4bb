package com.smartexec.execution.marketdata;

import java.math.BigDecimal;
import java.util.Objects;

public record PriceLevel(BigDecimal price, long quantity) {
  public PriceLevel {
    Objects.requireNonNull(price, "price must not be null");
    if (price.signum() <= 0) {
      throw new IllegalArgumentException("price must be > 0");
    }
    if (quantity < 0) {
      throw new IllegalArgumentException("quantity must be >= 0");
    }
  }
}
