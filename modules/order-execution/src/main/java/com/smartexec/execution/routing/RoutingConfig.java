package com.smartexec.execution.routing;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Routing options.
 *
 * @param venues eligible venues; their order is the final tie-breaker
 * @param venueLatencies expected latency per venue, missing venues count as zero
 * @param maxVenueLatency venues slower than this are skipped; null disables the filter
 * @param aggressiveness share of each book level the router may take, in (0, 1]
 * @param maxSplitVenues upper bound on routes of a split plan
 * @param venueFeeRatesBps per-venue fee used by {@link RoutingStrategy#LOWEST_COST}
 */
public record RoutingConfig(
    RoutingStrategy routingStrategy,
    List<String> venues,
    Map<String, Duration> venueLatencies,
    Duration maxVenueLatency,
    boolean enableDarkPools,
    Set<String> darkPoolVenues,
    BigDecimal aggressiveness,
    int maxSplitVenues,
    Map<String, BigDecimal> venueFeeRatesBps) {
  public RoutingConfig {
    Objects.requireNonNull(routingStrategy, "routingStrategy must not be null");
    venues = venues == null ? List.of() : List.copyOf(venues);
    venueLatencies = venueLatencies == null ? Map.of() : Map.copyOf(venueLatencies);
    darkPoolVenues = darkPoolVenues == null ? Set.of() : Set.copyOf(darkPoolVenues);
    venueFeeRatesBps = venueFeeRatesBps == null ? Map.of() : Map.copyOf(venueFeeRatesBps);
    aggressiveness = aggressiveness == null ? BigDecimal.ONE : aggressiveness;
    if (aggressiveness.signum() <= 0 || aggressiveness.compareTo(BigDecimal.ONE) > 0) {
      throw new IllegalArgumentException("aggressiveness must be in (0, 1]");
    }
    if (maxSplitVenues < 1) {
      throw new IllegalArgumentException("maxSplitVenues must be >= 1");
    }
  }

  public static RoutingConfig bestExecution(List<String> venues) {
    return new RoutingConfig(
        RoutingStrategy.BEST_EXECUTION,
        venues,
        Map.of(),
        null,
        false,
        Set.of(),
        BigDecimal.ONE,
        Math.max(1, venues.size()),
        Map.of());
  }

  public RoutingConfig withAggressiveness(BigDecimal nextAggressiveness) {
    return new RoutingConfig(
        routingStrategy,
        venues,
        venueLatencies,
        maxVenueLatency,
        enableDarkPools,
        darkPoolVenues,
        nextAggressiveness,
        maxSplitVenues,
        venueFeeRatesBps);
  }

  public RoutingConfig withStrategy(RoutingStrategy nextStrategy) {
    return new RoutingConfig(
        nextStrategy,
        venues,
        venueLatencies,
        maxVenueLatency,
        enableDarkPools,
        darkPoolVenues,
        aggressiveness,
        maxSplitVenues,
        venueFeeRatesBps);
  }

  public RoutingConfig withVenueLatencies(Map<String, Duration> nextLatencies, Duration nextMax) {
    return new RoutingConfig(
        routingStrategy,
        venues,
        nextLatencies,
        nextMax,
        enableDarkPools,
        darkPoolVenues,
        aggressiveness,
        maxSplitVenues,
        venueFeeRatesBps);
  }

  public RoutingConfig withDarkPools(boolean enabled, Set<String> nextDarkPoolVenues) {
    return new RoutingConfig(
        routingStrategy,
        venues,
        venueLatencies,
        maxVenueLatency,
        enabled,
        nextDarkPoolVenues,
        aggressiveness,
        maxSplitVenues,
        venueFeeRatesBps);
  }

  public Duration latencyOf(String venue) {
    return venueLatencies.getOrDefault(venue, Duration.ZERO);
  }

  public boolean isDarkPool(String venue) {
    return darkPoolVenues.contains(venue);
  }
}
