package com.smartexec.execution.lifecycle;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;

/**
 * Downstream consumer of committed ledger changes (allocation, settlement, analytics). Called
 * after the order lock is released, in commit order per order.
 */
public interface OrderEventListener {
  void onOrderUpdated(Order previous, Order current, String reason);

  default void onExecutionApplied(Order order, ExecutionReport report) {}
}
