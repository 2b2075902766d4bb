package com.smartexec.execution.observability;

import com.smartexec.domain.orders.OrderStatus;

public class NoOpExecutionTelemetry implements ExecutionTelemetry {
  @Override
  public void onOrderTransition(OrderStatus from, OrderStatus to) {}

  @Override
  public void onExecutionApplied(String venue, long quantity) {}

  @Override
  public void onDuplicateExecution(String venue) {}

  @Override
  public void onVenueCall(String venue, String outcome, long durationNanos) {}

  @Override
  public void onFallback(String failedVenue, String outcome) {}

  @Override
  public void onComplianceRejected(String symbol) {}

  @Override
  public void onSliceDispatched(String algorithm, long targetQuantity, long filledQuantity) {}
}
