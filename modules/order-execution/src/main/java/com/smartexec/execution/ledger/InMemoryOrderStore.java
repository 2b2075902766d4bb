package com.smartexec.execution.ledger;

import com.smartexec.domain.orders.Order;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryOrderStore implements OrderStore {
  private final Map<String, Order> orders = new ConcurrentHashMap<>();

  @Override
  public Optional<Order> load(String orderId) {
    return Optional.ofNullable(orders.get(orderId));
  }

  @Override
  public void save(Order order) {
    Objects.requireNonNull(order, "order must not be null");
    orders.put(order.orderId(), order);
  }
}
