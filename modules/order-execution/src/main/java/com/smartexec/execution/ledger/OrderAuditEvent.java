package com.smartexec.execution.ledger;

import com.smartexec.domain.orders.OrderStatus;
import java.time.Instant;
import java.util.Objects;

public record OrderAuditEvent(
    String orderId,
    AuditEventType eventType,
    OrderStatus fromStatus,
    OrderStatus toStatus,
    String detail,
    Instant occurredAt) {
  public OrderAuditEvent {
    Objects.requireNonNull(orderId, "orderId must not be null");
    Objects.requireNonNull(eventType, "eventType must not be null");
    Objects.requireNonNull(toStatus, "toStatus must not be null");
    Objects.requireNonNull(occurredAt, "occurredAt must not be null");
  }
}
