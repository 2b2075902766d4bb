package com.smartexec.execution.observability;

import com.smartexec.domain.orders.OrderStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerExecutionTelemetry implements ExecutionTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerExecutionTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onOrderTransition(OrderStatus from, OrderStatus to) {
    Counter.builder("execution.order.transition.total")
        .description("Committed order state transitions")
        .tag("from", from == null ? "none" : from.name())
        .tag("to", to == null ? "none" : to.name())
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onExecutionApplied(String venue, long quantity) {
    Counter.builder("execution.fill.total")
        .description("Execution reports applied to the ledger")
        .tag("venue", safeValue(venue))
        .tag("outcome", "applied")
        .register(meterRegistry)
        .increment();

    DistributionSummary.builder("execution.fill.quantity")
        .description("Quantity per applied execution report")
        .tag("venue", safeValue(venue))
        .register(meterRegistry)
        .record(Math.max(0L, quantity));
  }

  @Override
  public void onDuplicateExecution(String venue) {
    Counter.builder("execution.fill.total")
        .description("Execution reports applied to the ledger")
        .tag("venue", safeValue(venue))
        .tag("outcome", "duplicate")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onVenueCall(String venue, String outcome, long durationNanos) {
    Counter.builder("execution.venue.call.total")
        .description("Venue execution calls by outcome")
        .tag("venue", safeValue(venue))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();

    Timer.builder("execution.venue.call.duration")
        .description("Venue execution call latency")
        .tag("venue", safeValue(venue))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onFallback(String failedVenue, String outcome) {
    Counter.builder("execution.venue.fallback.total")
        .description("One-shot fallback routing attempts by outcome")
        .tag("venue", safeValue(failedVenue))
        .tag("outcome", safeValue(outcome))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onComplianceRejected(String symbol) {
    Counter.builder("execution.compliance.rejected.total")
        .description("Orders and slices blocked by the compliance gate")
        .tag("symbol", safeValue(symbol))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onSliceDispatched(String algorithm, long targetQuantity, long filledQuantity) {
    Counter.builder("execution.algo.slice.total")
        .description("Algorithmic slices dispatched")
        .tag("algorithm", safeValue(algorithm))
        .tag("outcome", filledQuantity >= targetQuantity ? "filled" : "partial")
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
