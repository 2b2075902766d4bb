package com.smartexec.execution.compliance;

import com.smartexec.domain.orders.OrderDomainException;
import java.util.stream.Collectors;

public class ComplianceRejectionException extends OrderDomainException {
  private final String orderId;
  private final ComplianceResult result;

  public ComplianceRejectionException(String orderId, ComplianceResult result) {
    super(
        "Order "
            + orderId
            + " rejected by compliance: "
            + result.violations().stream()
                .map(check -> check.name() + " (" + check.message() + ")")
                .collect(Collectors.joining(", ")));
    this.orderId = orderId;
    this.result = result;
  }

  public String orderId() {
    return orderId;
  }

  public ComplianceResult result() {
    return result;
  }
}
