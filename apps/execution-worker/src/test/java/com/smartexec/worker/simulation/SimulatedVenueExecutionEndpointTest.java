package com.smartexec.worker.simulation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.OrderSide;
import com.smartexec.domain.orders.OrderType;
import com.smartexec.execution.dispatch.VenueExecutionRequest;
import com.smartexec.execution.dispatch.VenueFailureException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class SimulatedVenueExecutionEndpointTest {
  private static final Instant NOW = Instant.parse("2026-03-02T14:30:00Z");

  private final SimulationProperties properties = new SimulationProperties();
  private final SimulatedVenueExecutionEndpoint endpoint =
      new SimulatedVenueExecutionEndpoint(properties, Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void shouldFillConfiguredShareAtExpectedPrice() {
    SimulationProperties.Venue nasdaq = new SimulationProperties.Venue();
    nasdaq.setFillRatio(new BigDecimal("0.8"));
    properties.getVenues().put("NASDAQ", nasdaq);

    ExecutionReport report = endpoint.execute(request("NASDAQ", 1001, "150.01"));

    assertEquals("NASDAQ-req-1", report.executionId());
    assertEquals("ord-1", report.orderId());
    assertEquals("ord-1-S1", report.sliceId());
    assertEquals(800L, report.quantity());
    assertEquals(new BigDecimal("150.01"), report.price());
    assertEquals(NOW, report.timestamp());
  }

  @Test
  void shouldFallBackToLimitPriceWithoutExpectedPrice() {
    properties.getVenues().put("NYSE", new SimulationProperties.Venue());

    ExecutionReport report = endpoint.execute(request("NYSE", 100, null));

    assertEquals(100L, report.quantity());
    assertEquals(new BigDecimal("150.05"), report.price());
  }

  @Test
  void shouldFailUnknownHaltedOrDryVenues() {
    SimulationProperties.Venue halted = new SimulationProperties.Venue();
    halted.setAvailable(false);
    properties.getVenues().put("ARCA", halted);
    SimulationProperties.Venue dry = new SimulationProperties.Venue();
    dry.setFillRatio(BigDecimal.ZERO);
    properties.getVenues().put("IEX", dry);

    VenueFailureException unknown =
        assertThrows(
            VenueFailureException.class, () -> endpoint.execute(request("BATS", 100, "150")));
    assertEquals("BATS", unknown.venue());
    assertThrows(
        VenueFailureException.class, () -> endpoint.execute(request("ARCA", 100, "150")));
    assertThrows(VenueFailureException.class, () -> endpoint.execute(request("IEX", 100, "150")));
  }

  private static VenueExecutionRequest request(String venue, long quantity, String expected) {
    return new VenueExecutionRequest(
        "req-1",
        "ord-1",
        "ord-1-S1",
        venue,
        "AAPL",
        OrderSide.BUY,
        OrderType.LIMIT,
        quantity,
        new BigDecimal("150.05"),
        expected == null ? null : new BigDecimal(expected));
  }
}
