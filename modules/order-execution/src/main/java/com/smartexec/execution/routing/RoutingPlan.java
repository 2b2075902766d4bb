package com.smartexec.execution.routing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Immutable routing decision. {@code confidence} is the share of the requested quantity the
 * visible books could absorb, capped at 1.
 */
public record RoutingPlan(
    String orderId,
    List<VenueRoute> routes,
    String primaryVenue,
    long requestedQuantity,
    BigDecimal confidence) {
  public RoutingPlan {
    routes = routes == null ? List.of() : List.copyOf(routes);
  }

  public static RoutingPlan empty(String orderId, long requestedQuantity) {
    return new RoutingPlan(orderId, List.of(), null, requestedQuantity, BigDecimal.ZERO);
  }

  static BigDecimal confidenceOf(long allocated, long requested) {
    if (requested <= 0) {
      return BigDecimal.ONE;
    }
    BigDecimal ratio =
        BigDecimal.valueOf(allocated)
            .divide(BigDecimal.valueOf(requested), 4, RoundingMode.HALF_UP);
    return ratio.min(BigDecimal.ONE);
  }

  public long allocatedQuantity() {
    return routes.stream().mapToLong(VenueRoute::quantity).sum();
  }

  public boolean isEmpty() {
    return routes.isEmpty();
  }

  public boolean isSplit() {
    return routes.size() > 1;
  }
}
