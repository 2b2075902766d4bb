package com.smartexec.execution.routing;

import java.math.BigDecimal;
import java.util.Objects;

/** One allocation line; {@code priority} 1 is the best ranked venue. */
public record VenueRoute(String venue, long quantity, BigDecimal expectedPrice, int priority) {
  public VenueRoute {
    Objects.requireNonNull(venue, "venue must not be null");
    if (quantity <= 0) {
      throw new IllegalArgumentException("route quantity must be > 0");
    }
  }
}
