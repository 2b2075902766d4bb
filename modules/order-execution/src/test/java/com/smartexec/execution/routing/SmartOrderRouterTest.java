package com.smartexec.execution.routing;

import static com.smartexec.execution.support.ExecutionFixtures.NOW;
import static com.smartexec.execution.support.ExecutionFixtures.asks;
import static com.smartexec.execution.support.ExecutionFixtures.level;
import static com.smartexec.execution.support.ExecutionFixtures.limitBuy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderEvent;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderSide;
import com.smartexec.execution.marketdata.OrderBookSnapshot;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SmartOrderRouterTest {
  private final SmartOrderRouter router = new SmartOrderRouter();

  @Test
  void shouldSplitAcrossVenuesWhenBestVenueCannotFillEverything() {
    Order order = accepted(limitBuy("AAPL", 1000, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("A", asks(level("150.00", 600)), "B", asks(level("150.01", 500)));

    RoutingPlan plan = router.route(order, quotes, RoutingConfig.bestExecution(List.of("A", "B")));

    assertEquals("A", plan.primaryVenue());
    assertEquals(2, plan.routes().size());
    assertEquals("A", plan.routes().get(0).venue());
    assertEquals(600, plan.routes().get(0).quantity());
    assertEquals("B", plan.routes().get(1).venue());
    assertEquals(400, plan.routes().get(1).quantity());
    assertEquals(0, new BigDecimal("150.01").compareTo(plan.routes().get(1).expectedPrice()));
    assertEquals(0, BigDecimal.ONE.compareTo(plan.confidence()));
    assertTrue(plan.isSplit());
  }

  @Test
  void shouldUseSingleVenueWhenItCoversTheQuantity() {
    Order order = accepted(limitBuy("AAPL", 500, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of(
            "A", asks(level("150.02", 1000)),
            "B", asks(level("150.00", 300), level("150.01", 300)));

    RoutingPlan plan = router.route(order, quotes, RoutingConfig.bestExecution(List.of("A", "B")));

    assertEquals(1, plan.routes().size());
    assertEquals("B", plan.primaryVenue());
    assertEquals(500, plan.routes().get(0).quantity());
    // 300 @ 150.00 + 200 @ 150.01
    assertEquals(
        0, new BigDecimal("150.004").compareTo(plan.routes().get(0).expectedPrice()));
  }

  @Test
  void shouldRankHighestBidFirstForSells() {
    Order order =
        accepted(OrderRequest.limit("c-1", "AAPL", OrderSide.SELL, 300, new BigDecimal("99")));
    Map<String, OrderBookSnapshot> quotes =
        Map.of(
            "A", OrderBookSnapshot.ofBids(level("100.00", 500)),
            "B", OrderBookSnapshot.ofBids(level("100.05", 500)));

    RoutingPlan plan = router.route(order, quotes, RoutingConfig.bestExecution(List.of("A", "B")));

    assertEquals("B", plan.primaryVenue());
    assertEquals(300, plan.allocatedQuantity());
  }

  @Test
  void shouldSkipDarkPoolsUnlessEnabled() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("LIT", asks(level("150.05", 100)), "DARK", asks(level("150.00", 100)));
    RoutingConfig base = RoutingConfig.bestExecution(List.of("LIT", "DARK"));

    RoutingPlan disabled = router.route(order, quotes, base.withDarkPools(false, Set.of("DARK")));
    RoutingPlan enabled = router.route(order, quotes, base.withDarkPools(true, Set.of("DARK")));

    assertEquals("LIT", disabled.primaryVenue());
    assertEquals("DARK", enabled.primaryVenue());
  }

  @Test
  void shouldPreferDarkPoolsUnderDarkPoolStrategy() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("LIT", asks(level("150.00", 100)), "DARK", asks(level("150.05", 100)));
    RoutingConfig config =
        RoutingConfig.bestExecution(List.of("LIT", "DARK"))
            .withDarkPools(true, Set.of("DARK"))
            .withStrategy(RoutingStrategy.DARK_POOL);

    assertEquals("DARK", router.route(order, quotes, config).primaryVenue());
  }

  @Test
  void shouldDropVenuesSlowerThanMaxLatency() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("FAST", asks(level("150.05", 100)), "SLOW", asks(level("150.00", 100)));
    RoutingConfig config =
        RoutingConfig.bestExecution(List.of("FAST", "SLOW"))
            .withVenueLatencies(
                Map.of("FAST", Duration.ofMillis(2), "SLOW", Duration.ofMillis(40)),
                Duration.ofMillis(10));

    RoutingPlan plan = router.route(order, quotes, config);

    assertEquals(List.of("FAST"), plan.routes().stream().map(VenueRoute::venue).toList());
  }

  @Test
  void shouldRankByLatencyUnderFastestStrategy() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("A", asks(level("150.00", 100)), "B", asks(level("150.05", 100)));
    RoutingConfig config =
        RoutingConfig.bestExecution(List.of("A", "B"))
            .withVenueLatencies(Map.of("A", Duration.ofMillis(8), "B", Duration.ofMillis(1)), null)
            .withStrategy(RoutingStrategy.FASTEST);

    assertEquals("B", router.route(order, quotes, config).primaryVenue());
  }

  @Test
  void shouldAddVenueFeesUnderLowestCostStrategy() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("A", asks(level("150.00", 100)), "B", asks(level("150.01", 100)));
    RoutingConfig config =
        new RoutingConfig(
            RoutingStrategy.LOWEST_COST,
            List.of("A", "B"),
            Map.of(),
            null,
            false,
            Set.of(),
            BigDecimal.ONE,
            2,
            Map.of("A", new BigDecimal("3")));

    assertEquals("B", router.route(order, quotes, config).primaryVenue());
  }

  @Test
  void shouldTakeOnlyTheAggressiveShareOfEachLevel() {
    Order order = accepted(limitBuy("AAPL", 1000, "150"));
    Map<String, OrderBookSnapshot> quotes = Map.of("A", asks(level("150.00", 1000)));
    RoutingConfig config =
        RoutingConfig.bestExecution(List.of("A")).withAggressiveness(new BigDecimal("0.5"));

    RoutingPlan plan = router.route(order, quotes, config);

    assertEquals(500, plan.allocatedQuantity());
    assertEquals(0, new BigDecimal("0.5").compareTo(plan.confidence()));
  }

  @Test
  void shouldReturnEmptyPlanWithoutLiquidity() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));

    RoutingPlan plan = router.route(order, Map.of(), RoutingConfig.bestExecution(List.of("A")));

    assertTrue(plan.isEmpty());
    assertEquals(0, BigDecimal.ZERO.compareTo(plan.confidence()));
  }

  @Test
  void shouldNeverRouteOutsideConfiguredVenues() {
    Random random = new Random(7);
    List<String> allVenues = List.of("A", "B", "C", "D", "E");
    for (int round = 0; round < 100; round++) {
      Order order = accepted(limitBuy("AAPL", 1 + random.nextInt(5000), "150"));
      Map<String, OrderBookSnapshot> quotes = new HashMap<>();
      for (String venue : allVenues) {
        quotes.put(
            venue,
            asks(
                level("150.0" + random.nextInt(10), 1 + random.nextInt(2000)),
                level("150.1" + random.nextInt(10), 1 + random.nextInt(2000))));
      }
      List<String> configured = allVenues.subList(0, 1 + random.nextInt(allVenues.size()));
      RoutingConfig config =
          new RoutingConfig(
              RoutingStrategy.values()[random.nextInt(RoutingStrategy.values().length)],
              configured,
              Map.of(),
              null,
              false,
              Set.of(),
              BigDecimal.ONE,
              1 + random.nextInt(3),
              Map.of());

      RoutingPlan plan = router.route(order, quotes, config);

      for (VenueRoute route : plan.routes()) {
        assertTrue(configured.contains(route.venue()), route.venue());
      }
      assertFalse(plan.allocatedQuantity() > order.remainingQuantity());
    }
  }

  @Test
  void shouldExcludeVenuesOnRequest() {
    Order order = accepted(limitBuy("AAPL", 100, "150"));
    Map<String, OrderBookSnapshot> quotes =
        Map.of("A", asks(level("150.00", 100)), "B", asks(level("150.01", 100)));

    RoutingPlan plan =
        router.route(
            order, 100, quotes, RoutingConfig.bestExecution(List.of("A", "B")), Set.of("A"));

    assertEquals("B", plan.primaryVenue());
  }

  private static Order accepted(OrderRequest request) {
    return Order.createPending("ord-1", request, NOW).apply(OrderEvent.ACCEPT, NOW);
  }
}
