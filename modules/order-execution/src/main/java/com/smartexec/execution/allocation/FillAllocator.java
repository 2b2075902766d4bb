package com.smartexec.execution.allocation;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderValidationException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Pro-rata split of an order's filled quantity across accounts. Each account gets the floor of
 * its share; the rounding remainder goes to the first account so the allocations add up to the
 * filled quantity.
 */
public class FillAllocator {
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
  private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

  public List<AccountAllocation> allocate(Order order, List<AccountShare> shares) {
    if (shares == null || shares.isEmpty()) {
      throw new OrderValidationException("At least one account share is required");
    }
    BigDecimal total =
        shares.stream().map(AccountShare::percentage).reduce(BigDecimal.ZERO, BigDecimal::add);
    if (total.subtract(HUNDRED).abs().compareTo(TOLERANCE) > 0) {
      throw new OrderValidationException(
          "Allocation percentages must sum to 100, got " + total.toPlainString());
    }

    long filled = order.filledQuantity();
    long[] quantities = new long[shares.size()];
    long assigned = 0L;
    for (int i = 0; i < shares.size(); i++) {
      quantities[i] =
          BigDecimal.valueOf(filled)
              .multiply(shares.get(i).percentage())
              .divide(total, 0, RoundingMode.FLOOR)
              .longValueExact();
      assigned += quantities[i];
    }
    quantities[0] += filled - assigned;

    List<AccountAllocation> allocations = new ArrayList<>(shares.size());
    for (int i = 0; i < shares.size(); i++) {
      allocations.add(
          new AccountAllocation(
              order.orderId(), shares.get(i).account(), quantities[i], order.averagePrice()));
    }
    return allocations;
  }
}
