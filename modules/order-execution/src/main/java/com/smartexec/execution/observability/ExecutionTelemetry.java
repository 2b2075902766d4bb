package com.smartexec.execution.observability;

import com.smartexec.domain.orders.OrderStatus;

public interface ExecutionTelemetry {
  void onOrderTransition(OrderStatus from, OrderStatus to);

  void onExecutionApplied(String venue, long quantity);

  void onDuplicateExecution(String venue);

  void onVenueCall(String venue, String outcome, long durationNanos);

  void onFallback(String failedVenue, String outcome);

  void onComplianceRejected(String symbol);

  void onSliceDispatched(String algorithm, long targetQuantity, long filledQuantity);
}
