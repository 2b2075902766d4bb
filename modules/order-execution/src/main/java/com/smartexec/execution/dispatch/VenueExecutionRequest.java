package com.smartexec.execution.dispatch;

import com.smartexec.domain.orders.OrderSide;
import com.smartexec.domain.orders.OrderType;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * One venue call. {@code orderId} is the ledger order that receives the fill; {@code sliceId}
 * is set when the call executes an algorithmic slice.
 */
public record VenueExecutionRequest(
    String requestId,
    String orderId,
    String sliceId,
    String venue,
    String symbol,
    OrderSide side,
    OrderType orderType,
    long quantity,
    BigDecimal limitPrice,
    BigDecimal expectedPrice) {
  public VenueExecutionRequest {
    Objects.requireNonNull(requestId, "requestId must not be null");
    Objects.requireNonNull(orderId, "orderId must not be null");
    Objects.requireNonNull(venue, "venue must not be null");
    if (quantity <= 0) {
      throw new IllegalArgumentException("quantity must be > 0");
    }
  }
}
