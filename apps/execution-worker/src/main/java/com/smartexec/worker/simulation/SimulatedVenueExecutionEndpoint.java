package com.smartexec.worker.simulation;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.execution.dispatch.VenueExecutionEndpoint;
import com.smartexec.execution.dispatch.VenueExecutionRequest;
import com.smartexec.execution.dispatch.VenueFailureException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills {@code fillRatio} of each request at the router's expected price after the configured
 * venue latency. Unknown or unavailable venues fail the call.
 */
public class SimulatedVenueExecutionEndpoint implements VenueExecutionEndpoint {
  private static final Logger log = LoggerFactory.getLogger(SimulatedVenueExecutionEndpoint.class);

  private final SimulationProperties properties;
  private final Clock clock;

  public SimulatedVenueExecutionEndpoint(SimulationProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public ExecutionReport execute(VenueExecutionRequest request) {
    SimulationProperties.Venue venue = properties.getVenues().get(request.venue());
    if (venue == null || !venue.isAvailable()) {
      throw new VenueFailureException(request.venue(), "venue unavailable: " + request.venue());
    }
    simulateLatency(request.venue(), venue.getLatency());

    long filled =
        BigDecimal.valueOf(request.quantity())
            .multiply(venue.getFillRatio())
            .setScale(0, RoundingMode.FLOOR)
            .longValue();
    filled = Math.min(filled, request.quantity());
    if (filled <= 0) {
      throw new VenueFailureException(
          request.venue(), "no fill for qty=" + request.quantity() + " on " + request.venue());
    }
    BigDecimal price = fillPrice(request);
    log.info(
        "Simulated fill venue={} orderId={} sliceId={} symbol={} side={} requested={} filled={} price={}",
        request.venue(),
        request.orderId(),
        request.sliceId(),
        request.symbol(),
        request.side(),
        request.quantity(),
        filled,
        price);
    return new ExecutionReport(
        request.venue() + "-" + request.requestId(),
        request.orderId(),
        request.sliceId(),
        request.venue(),
        filled,
        price,
        clock.instant());
  }

  private static BigDecimal fillPrice(VenueExecutionRequest request) {
    if (request.expectedPrice() != null) {
      return request.expectedPrice();
    }
    if (request.limitPrice() != null) {
      return request.limitPrice();
    }
    throw new VenueFailureException(request.venue(), "no reference price for " + request.symbol());
  }

  private static void simulateLatency(String venue, Duration latency) {
    if (latency == null || latency.isZero() || latency.isNegative()) {
      return;
    }
    try {
      Thread.sleep(latency.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new VenueFailureException(venue, "interrupted while executing on " + venue, ex);
    }
  }
}
