package com.smartexec.execution.ledger;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryOrderAuditRepository implements OrderAuditRepository {
  private final Map<String, List<OrderAuditEvent>> eventsByOrder = new ConcurrentHashMap<>();

  @Override
  public void append(OrderAuditEvent event) {
    Objects.requireNonNull(event, "event must not be null");
    eventsByOrder
        .computeIfAbsent(event.orderId(), ignored -> new CopyOnWriteArrayList<>())
        .add(event);
  }

  @Override
  public List<OrderAuditEvent> findByOrderId(String orderId) {
    List<OrderAuditEvent> events = eventsByOrder.get(orderId);
    return events == null ? List.of() : List.copyOf(events);
  }
}
