package com.smartexec.execution.ledger;

import com.smartexec.domain.orders.Order;
import java.util.Optional;

/** Persistence port for order snapshots. Saves are assumed at-least-once durable. */
public interface OrderStore {
  Optional<Order> load(String orderId);

  void save(Order order);
}
