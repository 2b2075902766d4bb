package com.smartexec.execution.marketdata;

import java.util.Comparator;
import java.util.List;

/** Book of one venue at one instant. Levels are re-sorted into walking order on construction. */
public record OrderBookSnapshot(List<PriceLevel> bids, List<PriceLevel> asks) {
  public OrderBookSnapshot {
    bids =
        bids == null
            ? List.of()
            : bids.stream().sorted(Comparator.comparing(PriceLevel::price).reversed()).toList();
    asks =
        asks == null
            ? List.of()
            : asks.stream().sorted(Comparator.comparing(PriceLevel::price)).toList();
  }

  public static OrderBookSnapshot ofAsks(PriceLevel... asks) {
    return new OrderBookSnapshot(List.of(), List.of(asks));
  }

  public static OrderBookSnapshot ofBids(PriceLevel... bids) {
    return new OrderBookSnapshot(List.of(bids), List.of());
  }

  /** Levels a buyer (asks) or seller (bids) walks, best first. */
  public List<PriceLevel> sideFor(boolean buy) {
    return buy ? asks : bids;
  }
}
