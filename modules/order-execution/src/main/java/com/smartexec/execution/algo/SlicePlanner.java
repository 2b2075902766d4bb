package com.smartexec.execution.algo;

import com.smartexec.domain.orders.AlgorithmParams;
import com.smartexec.domain.orders.Order;
import com.smartexec.execution.marketdata.MarketActivitySource;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static slice plans for TWAP, VWAP and iceberg orders. Planned quantities always sum to the
 * parent quantity; the last slice absorbs the rounding remainder. POV has no static plan.
 */
public class SlicePlanner {
  private final MarketActivitySource marketActivity;

  public SlicePlanner(MarketActivitySource marketActivity) {
    this.marketActivity = Objects.requireNonNull(marketActivity, "marketActivity must not be null");
  }

  public List<OrderSlice> plan(Order parent, AlgorithmParams params) {
    return switch (parent.algorithmType()) {
      case TWAP -> twap(parent, params);
      case VWAP -> vwap(parent, params);
      case ICEBERG -> iceberg(parent, params);
      case POV -> List.of();
    };
  }

  /** {@code floor(quantity / slices)} each, the last slice takes the remainder. */
  public static List<Long> twapQuantities(long quantity, int slices) {
    if (slices < 1) {
      throw new IllegalArgumentException("slices must be >= 1");
    }
    long base = quantity / slices;
    List<Long> quantities = new ArrayList<>(Collections.nCopies(slices, base));
    quantities.set(slices - 1, quantity - base * (slices - 1));
    return quantities;
  }

  /**
   * {@code floor(quantity * w_i / sum(w))} each, the last slice takes the remainder. The curve
   * does not need to be normalised.
   */
  public static List<Long> vwapQuantities(long quantity, List<BigDecimal> curve) {
    if (curve.isEmpty()) {
      throw new IllegalArgumentException("curve must not be empty");
    }
    BigDecimal total = curve.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    if (total.signum() <= 0) {
      return twapQuantities(quantity, curve.size());
    }
    List<Long> quantities = new ArrayList<>(curve.size());
    long assigned = 0L;
    for (int i = 0; i < curve.size() - 1; i++) {
      long sliceQuantity =
          BigDecimal.valueOf(quantity)
              .multiply(curve.get(i))
              .divide(total, 0, RoundingMode.FLOOR)
              .longValueExact();
      quantities.add(sliceQuantity);
      assigned += sliceQuantity;
    }
    quantities.add(quantity - assigned);
    return quantities;
  }

  /** {@code ceil(window / interval)}, at least one. */
  public static int sliceCount(Instant start, Instant end, Duration interval) {
    long windowMillis = Duration.between(start, end).toMillis();
    long intervalMillis = interval.toMillis();
    return (int) Math.max(1L, (windowMillis + intervalMillis - 1) / intervalMillis);
  }

  private List<OrderSlice> twap(Order parent, AlgorithmParams params) {
    Duration interval = params.effectiveSliceInterval();
    int count = sliceCount(params.startTime(), params.endTime(), interval);
    return toSlices(
        parent, twapQuantities(parent.remainingQuantity(), count), params.startTime(), interval);
  }

  private List<OrderSlice> vwap(Order parent, AlgorithmParams params) {
    List<BigDecimal> curve = params.customCurve();
    if (curve.isEmpty()) {
      int buckets =
          sliceCount(params.startTime(), params.endTime(), params.effectiveSliceInterval());
      curve =
          marketActivity.volumeProfile(
              parent.symbol(), params.startTime(), params.endTime(), buckets);
      if (curve == null || curve.isEmpty()) {
        curve = Collections.nCopies(buckets, BigDecimal.ONE);
      }
    }
    Duration spacing =
        Duration.between(params.startTime(), params.endTime()).dividedBy(curve.size());
    return toSlices(
        parent, vwapQuantities(parent.remainingQuantity(), curve), params.startTime(), spacing);
  }

  private List<OrderSlice> iceberg(Order parent, AlgorithmParams params) {
    long display = params.displayQuantity();
    long remaining = parent.remainingQuantity();
    List<Long> quantities = new ArrayList<>();
    while (remaining > 0) {
      long clip = Math.min(display, remaining);
      quantities.add(clip);
      remaining -= clip;
    }
    return toSlices(parent, quantities, params.startTime(), params.effectiveSliceInterval());
  }

  private static List<OrderSlice> toSlices(
      Order parent, List<Long> quantities, Instant start, Duration spacing) {
    List<OrderSlice> slices = new ArrayList<>(quantities.size());
    for (int i = 0; i < quantities.size(); i++) {
      slices.add(
          OrderSlice.planned(
              parent.orderId(), i + 1, quantities.get(i), start.plus(spacing.multipliedBy(i))));
    }
    return slices;
  }
}
