package com.smartexec.execution.service;

import com.smartexec.domain.orders.Order;
import com.smartexec.execution.algo.OrderSlice;
import com.smartexec.execution.compliance.ComplianceCheck;
import com.smartexec.execution.dispatch.DispatchResult;
import java.util.List;

/**
 * Result of a submit. Direct orders carry the {@code dispatch} of their routing plan; algorithmic
 * orders carry their planned {@code slices} and an empty dispatch, fills arriving as the slices
 * come due.
 */
public record OrderSubmission(
    Order order, List<ComplianceCheck> warnings, DispatchResult dispatch, List<OrderSlice> slices) {
  public OrderSubmission {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    slices = slices == null ? List.of() : List.copyOf(slices);
  }

  public boolean scheduled() {
    return order.isAlgorithmic();
  }
}
