package com.smartexec.domain.orders;

import java.math.BigDecimal;

/** Requested amendment of a live order. Null fields are left unchanged. */
public record OrderChanges(Long quantity, BigDecimal limitPrice, String reason) {
  public OrderChanges {
    if (quantity == null && limitPrice == null) {
      throw new OrderValidationException("Order amendment must change quantity or limitPrice");
    }
    if (quantity != null && quantity <= 0) {
      throw new OrderValidationException("quantity must be > 0");
    }
    if (limitPrice != null && limitPrice.signum() <= 0) {
      throw new OrderValidationException("limitPrice must be > 0");
    }
  }

  public static OrderChanges quantity(long quantity, String reason) {
    return new OrderChanges(quantity, null, reason);
  }

  public static OrderChanges limitPrice(BigDecimal limitPrice, String reason) {
    return new OrderChanges(null, limitPrice, reason);
  }
}
