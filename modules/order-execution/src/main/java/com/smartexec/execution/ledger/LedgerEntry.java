package com.smartexec.execution.ledger;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one order. Only reachable through {@link OrderLedger#update}, which holds
 * the entry lock for the duration of the callback.
 */
public final class LedgerEntry {
  private final ReentrantLock lock = new ReentrantLock();
  private final Set<String> appliedExecutionIds = new HashSet<>();
  private final List<ExecutionReport> executions = new ArrayList<>();
  private final OrderStore store;
  private volatile Order order;
  private int outstandingActivity;

  LedgerEntry(Order order, OrderStore store) {
    this.order = order;
    this.store = store;
  }

  ReentrantLock lock() {
    return lock;
  }

  public Order order() {
    return order;
  }

  public void replace(Order next) {
    if (!order.orderId().equals(next.orderId())) {
      throw new IllegalArgumentException(
          "Ledger entry " + order.orderId() + " cannot hold order " + next.orderId());
    }
    store.save(next);
    order = next;
  }

  public boolean hasExecution(String executionId) {
    return appliedExecutionIds.contains(executionId);
  }

  public void recordExecution(ExecutionReport report) {
    appliedExecutionIds.add(report.executionId());
    executions.add(report);
  }

  public List<ExecutionReport> executions() {
    return List.copyOf(executions);
  }

  public int outstandingActivity() {
    return outstandingActivity;
  }

  public int beginActivity() {
    return ++outstandingActivity;
  }

  public int endActivity() {
    if (outstandingActivity > 0) {
      outstandingActivity--;
    }
    return outstandingActivity;
  }
}
