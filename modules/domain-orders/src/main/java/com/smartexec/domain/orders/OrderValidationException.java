package com.smartexec.domain.orders;

public class OrderValidationException extends OrderDomainException {
  public OrderValidationException(String message) {
    super(message);
  }
}
