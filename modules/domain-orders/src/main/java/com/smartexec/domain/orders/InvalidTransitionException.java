package com.smartexec.domain.orders;

public class InvalidTransitionException extends OrderDomainException {
  private final OrderStatus from;
  private final OrderEvent event;

  public InvalidTransitionException(OrderStatus from, OrderEvent event) {
    super("Invalid order transition: event " + event + " is not allowed in status " + from);
    this.from = from;
    this.event = event;
  }

  public OrderStatus from() {
    return from;
  }

  public OrderEvent event() {
    return event;
  }
}
