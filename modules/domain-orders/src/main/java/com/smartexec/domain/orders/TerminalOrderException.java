package com.smartexec.domain.orders;

public class TerminalOrderException extends OrderDomainException {
  private final String orderId;
  private final OrderStatus status;

  public TerminalOrderException(String orderId, OrderStatus status, String operation) {
    super(
        String.format(
            "Cannot %s order %s in terminal status %s", operation, orderId, status));
    this.orderId = orderId;
    this.status = status;
  }

  public String orderId() {
    return orderId;
  }

  public OrderStatus status() {
    return status;
  }
}
