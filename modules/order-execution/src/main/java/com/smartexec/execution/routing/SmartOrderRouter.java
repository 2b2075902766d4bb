package com.smartexec.execution.routing;

import com.smartexec.domain.orders.Order;
import com.smartexec.execution.marketdata.OrderBookSnapshot;
import com.smartexec.execution.marketdata.PriceLevel;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link RoutingPlan} from venue books. Pure: the same order snapshot, quotes and
 * config always give the same plan, so a plan can be recomputed on retry.
 */
public class SmartOrderRouter {
  private static final Logger log = LoggerFactory.getLogger(SmartOrderRouter.class);
  private static final int PRICE_SCALE = 8;
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);

  public RoutingPlan route(
      Order order, Map<String, OrderBookSnapshot> quotes, RoutingConfig config) {
    return route(order, order.remainingQuantity(), quotes, config, Set.of());
  }

  public RoutingPlan route(
      Order order,
      long quantity,
      Map<String, OrderBookSnapshot> quotes,
      RoutingConfig config,
      Set<String> excludedVenues) {
    Objects.requireNonNull(order, "order must not be null");
    Objects.requireNonNull(config, "config must not be null");
    if (quantity <= 0) {
      return RoutingPlan.empty(order.orderId(), quantity);
    }
    Map<String, OrderBookSnapshot> books = quotes == null ? Map.of() : quotes;
    Set<String> excluded = excludedVenues == null ? Set.of() : excludedVenues;
    boolean buy = order.side().isBuy();

    List<VenueDepth> candidates = new ArrayList<>();
    for (int index = 0; index < config.venues().size(); index++) {
      String venue = config.venues().get(index);
      if (!isEligible(venue, books, config, excluded)) {
        continue;
      }
      VenueDepth depth =
          VenueDepth.walk(
              venue,
              index,
              books.get(venue).sideFor(buy),
              quantity,
              config.aggressiveness(),
              config.latencyOf(venue),
              config.isDarkPool(venue));
      if (depth.available() > 0) {
        candidates.add(depth);
      }
    }

    if (candidates.isEmpty()) {
      log.info(
          "No eligible venue orderId={} symbol={} side={} qty={} excluded={}",
          order.orderId(),
          order.symbol(),
          order.side(),
          quantity,
          excluded);
      return RoutingPlan.empty(order.orderId(), quantity);
    }

    candidates.sort(ranking(buy, config));
    List<VenueRoute> routes = new ArrayList<>();
    VenueDepth best = candidates.get(0);
    if (config.routingStrategy() != RoutingStrategy.CUSTOM && best.available() >= quantity) {
      routes.add(new VenueRoute(best.venue(), quantity, best.priceFor(quantity), 1));
    } else {
      long remaining = quantity;
      for (VenueDepth candidate : candidates) {
        if (remaining <= 0 || routes.size() >= config.maxSplitVenues()) {
          break;
        }
        long take = Math.min(remaining, candidate.available());
        routes.add(
            new VenueRoute(candidate.venue(), take, candidate.priceFor(take), routes.size() + 1));
        remaining -= take;
      }
    }

    long allocated = routes.stream().mapToLong(VenueRoute::quantity).sum();
    RoutingPlan plan =
        new RoutingPlan(
            order.orderId(),
            routes,
            routes.get(0).venue(),
            quantity,
            RoutingPlan.confidenceOf(allocated, quantity));
    log.debug(
        "Routing plan orderId={} strategy={} routes={} confidence={}",
        order.orderId(),
        config.routingStrategy(),
        routes,
        plan.confidence());
    return plan;
  }

  private static boolean isEligible(
      String venue,
      Map<String, OrderBookSnapshot> books,
      RoutingConfig config,
      Set<String> excluded) {
    if (excluded.contains(venue) || !books.containsKey(venue)) {
      return false;
    }
    if (config.isDarkPool(venue) && !config.enableDarkPools()) {
      return false;
    }
    Duration maxLatency = config.maxVenueLatency();
    return maxLatency == null || config.latencyOf(venue).compareTo(maxLatency) <= 0;
  }

  private static Comparator<VenueDepth> ranking(boolean buy, RoutingConfig config) {
    Comparator<VenueDepth> byPrice =
        Comparator.comparing(depth -> rankingPrice(depth, buy, config));
    if (!buy) {
      byPrice = byPrice.reversed();
    }
    Comparator<VenueDepth> byLatency = Comparator.comparing(VenueDepth::latency);
    Comparator<VenueDepth> byOrder = Comparator.comparingInt(VenueDepth::index);

    return switch (config.routingStrategy()) {
      case FASTEST -> byLatency.thenComparing(byPrice).thenComparing(byOrder);
      case DARK_POOL ->
          Comparator.comparing((VenueDepth depth) -> !depth.dark())
              .thenComparing(byPrice)
              .thenComparing(byLatency)
              .thenComparing(byOrder);
      default -> byPrice.thenComparing(byLatency).thenComparing(byOrder);
    };
  }

  private static BigDecimal rankingPrice(VenueDepth depth, boolean buy, RoutingConfig config) {
    if (config.routingStrategy() != RoutingStrategy.LOWEST_COST) {
      return depth.vwap();
    }
    BigDecimal feeBps = config.venueFeeRatesBps().getOrDefault(depth.venue(), BigDecimal.ZERO);
    BigDecimal feeFactor = feeBps.divide(BPS, PRICE_SCALE, RoundingMode.HALF_UP);
    BigDecimal adjustment = depth.vwap().multiply(feeFactor);
    return buy ? depth.vwap().add(adjustment) : depth.vwap().subtract(adjustment);
  }

  /** Liquidity reachable on one venue for the requested quantity. */
  private record VenueDepth(
      String venue,
      int index,
      List<PriceLevel> takeable,
      long available,
      BigDecimal vwap,
      Duration latency,
      boolean dark) {

    static VenueDepth walk(
        String venue,
        int index,
        List<PriceLevel> levels,
        long quantity,
        BigDecimal aggressiveness,
        Duration latency,
        boolean dark) {
      List<PriceLevel> takeable = new ArrayList<>();
      long remaining = quantity;
      for (PriceLevel level : levels) {
        if (remaining <= 0) {
          break;
        }
        long visible =
            BigDecimal.valueOf(level.quantity())
                .multiply(aggressiveness)
                .setScale(0, RoundingMode.FLOOR)
                .longValueExact();
        long take = Math.min(remaining, visible);
        if (take > 0) {
          takeable.add(new PriceLevel(level.price(), take));
          remaining -= take;
        }
      }
      long available = quantity - remaining;
      BigDecimal vwap = available == 0 ? null : vwapOf(takeable, available);
      return new VenueDepth(venue, index, takeable, available, vwap, latency, dark);
    }

    BigDecimal priceFor(long quantity) {
      return vwapOf(takeable, quantity);
    }

    private static BigDecimal vwapOf(List<PriceLevel> levels, long quantity) {
      BigDecimal notional = BigDecimal.ZERO;
      long remaining = quantity;
      for (PriceLevel level : levels) {
        if (remaining <= 0) {
          break;
        }
        long take = Math.min(remaining, level.quantity());
        notional = notional.add(level.price().multiply(BigDecimal.valueOf(take)));
        remaining -= take;
      }
      long walked = quantity - remaining;
      return notional.divide(BigDecimal.valueOf(walked), PRICE_SCALE, RoundingMode.HALF_UP);
    }
  }
}
