package com.smartexec.execution.ledger;

import java.util.List;

public interface OrderAuditRepository {
  void append(OrderAuditEvent event);

  /** Events for the order in the order they were appended. */
  List<OrderAuditEvent> findByOrderId(String orderId);
}
