package com.smartexec.domain.orders;

public class UnknownOrderException extends OrderDomainException {
  private final String orderId;

  public UnknownOrderException(String orderId) {
    super("Order not found: " + orderId);
    this.orderId = orderId;
  }

  public String orderId() {
    return orderId;
  }
}
