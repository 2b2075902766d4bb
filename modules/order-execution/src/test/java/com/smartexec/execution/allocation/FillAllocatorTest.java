package com.smartexec.execution.allocation;

import static com.smartexec.execution.support.ExecutionFixtures.NOW;
import static com.smartexec.execution.support.ExecutionFixtures.limitBuy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderEvent;
import com.smartexec.domain.orders.OrderValidationException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class FillAllocatorTest {
  private final FillAllocator allocator = new FillAllocator();

  @Test
  void shouldGiveRoundingRemainderToFirstAccount() {
    Order order = filled(1000, 1000);

    List<AccountAllocation> allocations =
        allocator.allocate(
            order,
            List.of(
                share("ACC-1", "33.33"), share("ACC-2", "33.33"), share("ACC-3", "33.34")));

    assertEquals(
        List.of(334L, 333L, 333L),
        allocations.stream().map(AccountAllocation::quantity).toList());
    assertEquals(
        1000L, allocations.stream().mapToLong(AccountAllocation::quantity).sum());
    assertEquals(0, order.averagePrice().compareTo(allocations.get(0).averagePrice()));
  }

  @Test
  void shouldAllocateOnlyFilledQuantity() {
    Order order = filled(1000, 401);

    List<AccountAllocation> allocations =
        allocator.allocate(order, List.of(share("ACC-1", "50"), share("ACC-2", "50")));

    assertEquals(201, allocations.get(0).quantity());
    assertEquals(200, allocations.get(1).quantity());
  }

  @Test
  void shouldRejectSharesNotSummingToHundred() {
    Order order = filled(1000, 1000);

    assertThrows(
        OrderValidationException.class,
        () -> allocator.allocate(order, List.of(share("ACC-1", "60"), share("ACC-2", "30"))));
    assertThrows(OrderValidationException.class, () -> allocator.allocate(order, List.of()));
  }

  private static AccountShare share(String account, String percentage) {
    return new AccountShare(account, new BigDecimal(percentage));
  }

  private static Order filled(long quantity, long filled) {
    return Order.createPending("ord-1", limitBuy("AAPL", quantity, "150"), NOW)
        .apply(OrderEvent.ACCEPT, NOW)
        .applyFill(filled, new BigDecimal("150.25"), NOW);
  }
}
