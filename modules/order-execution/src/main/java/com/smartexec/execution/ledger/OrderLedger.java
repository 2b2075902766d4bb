package com.smartexec.execution.ledger;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderValidationException;
import com.smartexec.domain.orders.UnknownOrderException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Authoritative record of every order. Mutations of one order are serialized on that order's
 * lock; different orders never contend.
 */
public class OrderLedger {
  private final ConcurrentMap<String, LedgerEntry> entries = new ConcurrentHashMap<>();
  private final OrderStore store;

  public OrderLedger(OrderStore store) {
    this.store = Objects.requireNonNull(store, "store must not be null");
  }

  public Order register(Order order) {
    Objects.requireNonNull(order, "order must not be null");
    LedgerEntry entry = new LedgerEntry(order, store);
    if (entries.putIfAbsent(order.orderId(), entry) != null) {
      throw new OrderValidationException("Order " + order.orderId() + " already exists");
    }
    store.save(order);
    return order;
  }

  public Optional<Order> find(String orderId) {
    return Optional.ofNullable(entryOrLoad(orderId)).map(LedgerEntry::order);
  }

  public Order get(String orderId) {
    return find(orderId).orElseThrow(() -> new UnknownOrderException(orderId));
  }

  public <T> T update(String orderId, Function<LedgerEntry, T> mutation) {
    LedgerEntry entry = entryOrLoad(orderId);
    if (entry == null) {
      throw new UnknownOrderException(orderId);
    }
    entry.lock().lock();
    try {
      return mutation.apply(entry);
    } finally {
      entry.lock().unlock();
    }
  }

  /** Point-in-time copy of all orders currently held in memory. */
  public List<Order> snapshot() {
    List<Order> orders = new ArrayList<>(entries.size());
    for (LedgerEntry entry : entries.values()) {
      orders.add(entry.order());
    }
    return orders;
  }

  private LedgerEntry entryOrLoad(String orderId) {
    if (orderId == null) {
      return null;
    }
    LedgerEntry entry = entries.get(orderId);
    if (entry != null) {
      return entry;
    }
    return entries.computeIfAbsent(
        orderId, id -> store.load(id).map(order -> new LedgerEntry(order, store)).orElse(null));
  }
}
