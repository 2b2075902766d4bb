package com.smartexec.domain.orders;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class OrderStateMachine {
  private static final Map<OrderStatus, Map<OrderEvent, OrderStatus>> TRANSITIONS =
      buildTransitions();

  private OrderStateMachine() {}

  public static Optional<OrderStatus> next(OrderStatus from, OrderEvent event) {
    if (from == null || event == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(TRANSITIONS.get(from).get(event));
  }

  public static boolean canApply(OrderStatus from, OrderEvent event) {
    return next(from, event).isPresent();
  }

  public static OrderStatus transition(OrderStatus from, OrderEvent event) {
    return next(from, event).orElseThrow(() -> new InvalidTransitionException(from, event));
  }

  private static Map<OrderStatus, Map<OrderEvent, OrderStatus>> buildTransitions() {
    Map<OrderStatus, Map<OrderEvent, OrderStatus>> table = new EnumMap<>(OrderStatus.class);
    for (OrderStatus status : OrderStatus.values()) {
      table.put(status, new EnumMap<>(OrderEvent.class));
    }

    table.get(OrderStatus.PENDING).put(OrderEvent.ACCEPT, OrderStatus.NEW);
    table.get(OrderStatus.PENDING).put(OrderEvent.REJECT, OrderStatus.REJECTED);
    table.get(OrderStatus.PENDING).put(OrderEvent.CANCEL_REQUEST, OrderStatus.PENDING_CANCEL);

    for (OrderStatus working : new OrderStatus[] {OrderStatus.NEW, OrderStatus.PARTIALLY_FILLED}) {
      Map<OrderEvent, OrderStatus> row = table.get(working);
      row.put(OrderEvent.PARTIAL_FILL, OrderStatus.PARTIALLY_FILLED);
      row.put(OrderEvent.FULL_FILL, OrderStatus.FILLED);
      row.put(OrderEvent.CANCEL_REQUEST, OrderStatus.PENDING_CANCEL);
      row.put(OrderEvent.REPLACE_REQUEST, OrderStatus.PENDING_REPLACE);
      row.put(OrderEvent.EXPIRE, OrderStatus.EXPIRED);
    }

    Map<OrderEvent, OrderStatus> pendingCancel = table.get(OrderStatus.PENDING_CANCEL);
    pendingCancel.put(OrderEvent.CANCEL_CONFIRM, OrderStatus.CANCELED);
    pendingCancel.put(OrderEvent.PARTIAL_FILL, OrderStatus.PENDING_CANCEL);
    pendingCancel.put(OrderEvent.FULL_FILL, OrderStatus.FILLED);

    Map<OrderEvent, OrderStatus> pendingReplace = table.get(OrderStatus.PENDING_REPLACE);
    pendingReplace.put(OrderEvent.REPLACE_CONFIRM, OrderStatus.REPLACED);
    pendingReplace.put(OrderEvent.CANCEL_REQUEST, OrderStatus.PENDING_CANCEL);
    pendingReplace.put(OrderEvent.PARTIAL_FILL, OrderStatus.PENDING_REPLACE);
    pendingReplace.put(OrderEvent.FULL_FILL, OrderStatus.FILLED);

    table.get(OrderStatus.REPLACED).put(OrderEvent.RESTATE, OrderStatus.NEW);
    table.get(OrderStatus.REPLACED).put(OrderEvent.RESTATE_PARTIAL, OrderStatus.PARTIALLY_FILLED);

    Map<OrderStatus, Map<OrderEvent, OrderStatus>> frozen = new EnumMap<>(OrderStatus.class);
    table.forEach((status, row) -> frozen.put(status, Collections.unmodifiableMap(row)));
    return Collections.unmodifiableMap(frozen);
  }
}
