package com.smartexec.domain.orders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * A fill reported by a venue. {@code orderId} always names the order whose fill state is
 * updated; for algorithmic slices that is the parent and {@code sliceId} names the slice.
 */
public record ExecutionReport(
    String executionId,
    String orderId,
    String sliceId,
    String venue,
    long quantity,
    BigDecimal price,
    Instant timestamp) {
  public ExecutionReport {
    requireNonBlank(executionId, "executionId");
    requireNonBlank(orderId, "orderId");
    requireNonBlank(venue, "venue");
    if (quantity <= 0) {
      throw new OrderValidationException("execution quantity must be > 0");
    }
    if (price == null || price.signum() <= 0) {
      throw new OrderValidationException("execution price must be > 0");
    }
    Objects.requireNonNull(timestamp, "timestamp must not be null");
  }

  public BigDecimal notional() {
    return price.multiply(BigDecimal.valueOf(quantity));
  }

  private static void requireNonBlank(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new OrderValidationException(fieldName + " must not be blank");
    }
  }
}
