package com.smartexec.execution.compliance;

import com.smartexec.domain.orders.Order;

public interface ComplianceGate {
  ComplianceResult check(Order order);
}
