package com.smartexec.execution.algo;

import com.smartexec.domain.orders.AlgorithmParams;
import com.smartexec.domain.orders.AlgorithmType;
import com.smartexec.domain.orders.BenchmarkType;
import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderStatus;
import com.smartexec.domain.orders.OrderValidationException;
import com.smartexec.domain.orders.UnknownOrderException;
import com.smartexec.execution.compliance.ComplianceGate;
import com.smartexec.execution.compliance.ComplianceResult;
import com.smartexec.execution.dispatch.DispatchResult;
import com.smartexec.execution.dispatch.ExecutionDispatcher;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import com.smartexec.execution.marketdata.MarketActivitySource;
import com.smartexec.execution.marketdata.OrderBookSnapshot;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import com.smartexec.execution.observability.ExecutionTelemetry;
import com.smartexec.execution.routing.RoutingConfig;
import com.smartexec.execution.routing.RoutingPlan;
import com.smartexec.execution.routing.SmartOrderRouter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives algorithmic parent orders. Each scheduled order gets one fixed-delay tick task; a
 * tick dispatches the slices that are due, carries unfilled remainder into the next slice and
 * stops the task once the parent is done, canceled or past its window.
 */
public class AlgorithmicScheduler {
  private static final Logger log = LoggerFactory.getLogger(AlgorithmicScheduler.class);
  private static final BigDecimal BPS = BigDecimal.valueOf(10_000);
  private static final int DEFAULT_RETAINED_FINISHED = 1_000;

  private final OrderLifecycleService lifecycle;
  private final ComplianceGate complianceGate;
  private final VenueQuoteSource quoteSource;
  private final MarketActivitySource marketActivity;
  private final SmartOrderRouter router;
  private final ExecutionDispatcher dispatcher;
  private final SlicePlanner planner;
  private final ScheduledExecutorService timer;
  private final RoutingConfig defaultRouting;
  private final Duration tickInterval;
  private final BigDecimal onScheduleTolerance;
  private final ExecutionTelemetry telemetry;
  private final Clock clock;
  private final int retainedFinished;
  private final Map<String, AlgoExecution> executions = new ConcurrentHashMap<>();
  private final Queue<String> finishedOrderIds = new ConcurrentLinkedQueue<>();

  public AlgorithmicScheduler(
      OrderLifecycleService lifecycle,
      ComplianceGate complianceGate,
      VenueQuoteSource quoteSource,
      MarketActivitySource marketActivity,
      SmartOrderRouter router,
      ExecutionDispatcher dispatcher,
      ScheduledExecutorService timer,
      RoutingConfig defaultRouting,
      Duration tickInterval,
      BigDecimal onScheduleTolerance,
      ExecutionTelemetry telemetry,
      Clock clock) {
    this(
        lifecycle,
        complianceGate,
        quoteSource,
        marketActivity,
        router,
        dispatcher,
        timer,
        defaultRouting,
        tickInterval,
        onScheduleTolerance,
        telemetry,
        clock,
        DEFAULT_RETAINED_FINISHED);
  }

  /**
   * @param retainedFinished completed or canceled executions kept for monitoring; older ones
   *     are evicted first
   */
  public AlgorithmicScheduler(
      OrderLifecycleService lifecycle,
      ComplianceGate complianceGate,
      VenueQuoteSource quoteSource,
      MarketActivitySource marketActivity,
      SmartOrderRouter router,
      ExecutionDispatcher dispatcher,
      ScheduledExecutorService timer,
      RoutingConfig defaultRouting,
      Duration tickInterval,
      BigDecimal onScheduleTolerance,
      ExecutionTelemetry telemetry,
      Clock clock,
      int retainedFinished) {
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
    this.complianceGate = Objects.requireNonNull(complianceGate, "complianceGate must not be null");
    this.quoteSource = Objects.requireNonNull(quoteSource, "quoteSource must not be null");
    this.marketActivity = Objects.requireNonNull(marketActivity, "marketActivity must not be null");
    this.router = Objects.requireNonNull(router, "router must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    this.planner = new SlicePlanner(marketActivity);
    this.timer = Objects.requireNonNull(timer, "timer must not be null");
    this.defaultRouting = Objects.requireNonNull(defaultRouting, "defaultRouting must not be null");
    this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval must not be null");
    this.onScheduleTolerance =
        onScheduleTolerance == null ? new BigDecimal("0.10") : onScheduleTolerance;
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.retainedFinished = Math.max(0, retainedFinished);
  }

  /** Plans the slices of an accepted algorithmic order and starts its tick task. */
  public List<OrderSlice> schedule(Order parent) {
    if (!parent.isAlgorithmic()) {
      throw new OrderValidationException("Order " + parent.orderId() + " is not algorithmic");
    }
    if (!parent.status().isWorking()) {
      throw new OrderValidationException(
          "Order " + parent.orderId() + " must be NEW or PARTIALLY_FILLED to schedule, was "
              + parent.status());
    }
    AlgorithmParams params = parent.algorithmParams();
    AlgoExecution execution =
        new AlgoExecution(
            parent.orderId(),
            parent.algorithmType(),
            params,
            defaultRouting,
            planner.plan(parent, params),
            arrivalPrice(parent));
    if (executions.putIfAbsent(parent.orderId(), execution) != null) {
      throw new OrderValidationException("Order " + parent.orderId() + " is already scheduled");
    }
    ScheduledFuture<?> task =
        timer.scheduleWithFixedDelay(
            () -> safeTick(parent.orderId()),
            0L,
            Math.max(1L, tickInterval.toMillis()),
            TimeUnit.MILLISECONDS);
    execution.task = task;
    // the first tick may already have finished the order before the task was published
    if (execution.isFinished()) {
      task.cancel(false);
    }
    log.info(
        "Algo scheduled orderId={} algorithm={} qty={} start={} end={} slices={} arrivalPrice={}",
        parent.orderId(),
        parent.algorithmType(),
        parent.quantity(),
        params.startTime(),
        params.endTime(),
        execution.slices.size(),
        execution.arrivalPrice);
    return List.copyOf(execution.slices);
  }

  /** Runs one scheduling step; returns the slices dispatched during it. */
  public List<OrderSlice> processTick(String orderId) {
    AlgoExecution execution = execution(orderId);
    if (!execution.tickLock.tryLock()) {
      return List.of();
    }
    try {
      if (execution.isFinished()) {
        return List.of();
      }
      Order parent = lifecycle.get(orderId);
      if (parent.status().isTerminal() || parent.status() == OrderStatus.PENDING_CANCEL) {
        finish(execution, parent);
        return List.of();
      }
      if (execution.state == AlgoState.PAUSED) {
        return List.of();
      }
      Instant now = clock.instant();
      AlgorithmParams params = execution.params;
      if (now.isBefore(params.startTime())) {
        return List.of();
      }
      List<OrderSlice> dispatched =
          execution.algorithmType == AlgorithmType.POV
              ? povTick(execution, parent, now)
              : plannedTick(execution, now);

      Order after = lifecycle.get(orderId);
      boolean windowOver = !now.isBefore(params.endTime());
      boolean nothingPending =
          execution.slices.stream().noneMatch(slice -> slice.status() == SliceStatus.PENDING);
      if (after.status().isTerminal() || (windowOver && nothingPending)) {
        finish(execution, after);
      }
      return dispatched;
    } finally {
      execution.tickLock.unlock();
    }
  }

  public void pause(String orderId, String reason) {
    AlgoExecution execution = execution(orderId);
    if (execution.state == AlgoState.RUNNING) {
      execution.state = AlgoState.PAUSED;
      log.info("Algo paused orderId={} reason={}", orderId, reason);
    }
  }

  public void resume(String orderId) {
    AlgoExecution execution = execution(orderId);
    if (execution.state == AlgoState.PAUSED) {
      execution.state = AlgoState.RUNNING;
      log.info("Algo resumed orderId={}", orderId);
    }
  }

  /** Applies to slices not yet dispatched; a slice already in flight keeps its settings. */
  public void adjustParameters(String orderId, AlgoAdjustment adjustment) {
    Objects.requireNonNull(adjustment, "adjustment must not be null");
    AlgoExecution execution = execution(orderId);
    if (adjustment.changesParticipation()) {
      AlgorithmParams next =
          execution.params.withParticipation(
              adjustment.minParticipationRate(),
              adjustment.maxParticipationRate(),
              adjustment.targetParticipationRate());
      if (execution.algorithmType == AlgorithmType.POV) {
        next.validateFor(AlgorithmType.POV);
      }
      execution.params = next;
    }
    if (adjustment.aggressiveness() != null) {
      execution.routing = execution.routing.withAggressiveness(adjustment.aggressiveness());
    }
    log.info(
        "Algo parameters adjusted orderId={} minRate={} maxRate={} targetRate={} aggressiveness={}",
        orderId,
        execution.params.minParticipationRate(),
        execution.params.maxParticipationRate(),
        execution.params.targetParticipationRate(),
        execution.routing.aggressiveness());
  }

  public AlgoProgress monitorProgress(String orderId) {
    AlgoExecution execution = execution(orderId);
    Order parent = lifecycle.get(orderId);
    Instant now = clock.instant();
    AlgorithmParams params = execution.params;

    BigDecimal progress = ratio(parent.filledQuantity(), parent.quantity());
    long windowMillis = Duration.between(params.startTime(), params.endTime()).toMillis();
    long elapsedMillis =
        Math.max(0L, Math.min(windowMillis, Duration.between(params.startTime(), now).toMillis()));
    BigDecimal expected = ratio(elapsedMillis, windowMillis);
    boolean onSchedule = progress.compareTo(expected.subtract(onScheduleTolerance)) >= 0;

    BenchmarkType benchmark = params.effectiveBenchmark();
    BigDecimal benchmarkPrice =
        benchmark == BenchmarkType.MARKET_VWAP
            ? marketActivity.vwapSince(parent.symbol(), params.startTime()).orElse(null)
            : execution.arrivalPrice;
    BigDecimal slippageBps = null;
    if (parent.filledQuantity() > 0 && benchmarkPrice != null && benchmarkPrice.signum() > 0) {
      BigDecimal difference =
          parent.side().isBuy()
              ? parent.averagePrice().subtract(benchmarkPrice)
              : benchmarkPrice.subtract(parent.averagePrice());
      slippageBps = difference.multiply(BPS).divide(benchmarkPrice, 2, RoundingMode.HALF_UP);
    }

    List<OrderSlice> slices = execution.slices;
    int completed = (int) slices.stream().filter(slice -> slice.status().isTerminal()).count();
    return new AlgoProgress(
        orderId,
        execution.algorithmType,
        parent.status(),
        execution.state,
        parent.quantity(),
        parent.filledQuantity(),
        progress,
        expected,
        parent.averagePrice(),
        benchmark,
        benchmarkPrice,
        slippageBps,
        onSchedule,
        completed,
        slices.size());
  }

  public List<OrderSlice> slices(String orderId) {
    return List.copyOf(execution(orderId).slices);
  }

  public boolean isScheduled(String orderId) {
    return executions.containsKey(orderId);
  }

  private void safeTick(String orderId) {
    try {
      processTick(orderId);
    } catch (RuntimeException ex) {
      log.error("Algo tick failed orderId={}", orderId, ex);
    }
  }

  private List<OrderSlice> plannedTick(AlgoExecution execution, Instant now) {
    List<OrderSlice> dispatched = new ArrayList<>();
    for (int index = 0; index < execution.slices.size(); index++) {
      OrderSlice slice = execution.slices.get(index);
      if (!slice.isDue(now)) {
        continue;
      }
      Order parent = lifecycle.get(execution.orderId);
      if (!parent.status().isWorking()) {
        break;
      }
      boolean last = isLastPending(execution, index);
      long target = slice.quantity() + execution.carry;
      if (last) {
        target = parent.remainingQuantity();
      }
      target = Math.min(target, parent.remainingQuantity());
      execution.carry = 0L;
      OrderSlice finished = dispatchSlice(execution, parent, slice, target, now);
      execution.replace(index, finished);
      execution.carry += finished.shortfall();
      dispatched.add(finished);
    }
    appendCatchUpSlice(execution, now);
    return dispatched;
  }

  private List<OrderSlice> povTick(AlgoExecution execution, Order parent, Instant now) {
    if (!now.isBefore(execution.params.endTime()) || !parent.status().isWorking()) {
      return List.of();
    }
    long marketVolume = marketActivity.volumeSince(parent.symbol(), execution.params.startTime());
    long quantity = povQuantity(execution.params, marketVolume, parent);
    if (quantity <= 0) {
      return List.of();
    }
    OrderSlice slice =
        OrderSlice.planned(execution.orderId, execution.slices.size() + 1, quantity, now);
    execution.slices = append(execution.slices, slice);
    OrderSlice finished = dispatchSlice(execution, parent, slice, quantity, now);
    execution.replace(execution.slices.size() - 1, finished);
    return List.of(finished);
  }

  /**
   * Child quantity that keeps cumulative participation inside the configured band:
   * {@code clamp(target*V - F, min*V - F, max*V - F)}, bounded by the parent remainder.
   */
  static long povQuantity(AlgorithmParams params, long marketVolume, Order parent) {
    BigDecimal volume = BigDecimal.valueOf(marketVolume);
    long filled = parent.filledQuantity();
    long lower = ceil(params.minParticipationRate().multiply(volume)) - filled;
    long upper = floor(params.maxParticipationRate().multiply(volume)) - filled;
    long desired = floor(params.effectiveTargetParticipationRate().multiply(volume)) - filled;
    long quantity = Math.max(lower, Math.min(desired, upper));
    return Math.min(quantity, parent.remainingQuantity());
  }

  private OrderSlice dispatchSlice(
      AlgoExecution execution, Order parent, OrderSlice slice, long target, Instant now) {
    OrderSlice active = slice.activate(target);
    execution.replace(execution.slices.indexOf(slice), active);
    if (target == 0) {
      return active.complete(0L);
    }

    Order child = parent.childSlice(slice.sliceId(), target, now);
    ComplianceResult compliance = complianceGate.check(child);
    if (compliance.isBlocked()) {
      telemetry.onComplianceRejected(parent.symbol());
      log.warn(
          "Slice blocked by compliance orderId={} sliceId={} qty={} violations={}",
          execution.orderId,
          slice.sliceId(),
          target,
          compliance.violations());
      return active.complete(0L);
    }

    RoutingConfig routing = execution.routing;
    Map<String, OrderBookSnapshot> quotes = quoteSource.quotes(parent.symbol(), routing.venues());
    RoutingPlan plan = router.route(child, quotes, routing);
    DispatchResult result =
        dispatcher.dispatch(execution.orderId, slice.sliceId(), child, plan, routing);
    OrderSlice finished = active.complete(result.totalFilled());
    telemetry.onSliceDispatched(
        execution.algorithmType.name(), target, result.totalFilled());
    log.info(
        "Slice dispatched orderId={} sliceId={} sequence={} target={} filled={} status={}",
        execution.orderId,
        slice.sliceId(),
        slice.sequence(),
        target,
        result.totalFilled(),
        finished.status());
    return finished;
  }

  private void appendCatchUpSlice(AlgoExecution execution, Instant now) {
    boolean pending =
        execution.slices.stream().anyMatch(slice -> slice.status() == SliceStatus.PENDING);
    if (pending || execution.carry <= 0 || !now.isBefore(execution.params.endTime())) {
      return;
    }
    Instant latest = execution.params.endTime().minusMillis(1);
    Instant next = now.plus(execution.params.effectiveSliceInterval());
    if (next.isAfter(latest)) {
      next = latest.isBefore(now) ? now : latest;
    }
    OrderSlice catchUp =
        OrderSlice.planned(
            execution.orderId, execution.slices.size() + 1, execution.carry, next);
    execution.carry = 0L;
    execution.slices = append(execution.slices, catchUp);
    log.info(
        "Catch-up slice appended orderId={} sliceId={} qty={} scheduledTime={}",
        execution.orderId,
        catchUp.sliceId(),
        catchUp.quantity(),
        catchUp.scheduledTime());
  }

  private void finish(AlgoExecution execution, Order parent) {
    List<OrderSlice> remaining = new ArrayList<>(execution.slices.size());
    int canceled = 0;
    for (OrderSlice slice : execution.slices) {
      if (slice.status() == SliceStatus.PENDING) {
        remaining.add(slice.cancel());
        canceled++;
      } else {
        remaining.add(slice);
      }
    }
    execution.slices = List.copyOf(remaining);
    boolean canceledParent =
        parent.status() == OrderStatus.CANCELED || parent.status() == OrderStatus.PENDING_CANCEL;
    execution.state = canceledParent ? AlgoState.CANCELED : AlgoState.COMPLETED;
    ScheduledFuture<?> task = execution.task;
    if (task != null) {
      task.cancel(false);
    }
    log.info(
        "Algo finished orderId={} state={} orderStatus={} filled={} remaining={} slicesCanceled={}",
        execution.orderId,
        execution.state,
        parent.status(),
        parent.filledQuantity(),
        parent.remainingQuantity(),
        canceled);
    retire(execution.orderId);
  }

  private void retire(String orderId) {
    finishedOrderIds.add(orderId);
    while (finishedOrderIds.size() > retainedFinished) {
      String evicted = finishedOrderIds.poll();
      if (evicted == null) {
        break;
      }
      executions.remove(evicted);
    }
  }

  private BigDecimal arrivalPrice(Order parent) {
    Map<String, OrderBookSnapshot> quotes =
        quoteSource.quotes(parent.symbol(), defaultRouting.venues());
    Optional<BigDecimal> touch =
        quotes.values().stream()
            .map(book -> book.sideFor(parent.side().isBuy()))
            .filter(levels -> !levels.isEmpty())
            .map(levels -> levels.get(0).price())
            .reduce(parent.side().isBuy() ? BigDecimal::min : BigDecimal::max);
    return touch.orElse(parent.effectiveLimitPrice());
  }

  private static boolean isLastPending(AlgoExecution execution, int index) {
    for (int i = index + 1; i < execution.slices.size(); i++) {
      if (execution.slices.get(i).status() == SliceStatus.PENDING) {
        return false;
      }
    }
    return true;
  }

  private AlgoExecution execution(String orderId) {
    AlgoExecution execution = executions.get(orderId);
    if (execution == null) {
      throw new UnknownOrderException(orderId);
    }
    return execution;
  }

  private static BigDecimal ratio(long numerator, long denominator) {
    if (denominator <= 0) {
      return BigDecimal.ONE;
    }
    return BigDecimal.valueOf(numerator)
        .divide(BigDecimal.valueOf(denominator), 4, RoundingMode.HALF_UP);
  }

  private static long floor(BigDecimal value) {
    return value.setScale(0, RoundingMode.FLOOR).longValueExact();
  }

  private static long ceil(BigDecimal value) {
    return value.setScale(0, RoundingMode.CEILING).longValueExact();
  }

  private static List<OrderSlice> append(List<OrderSlice> slices, OrderSlice slice) {
    List<OrderSlice> next = new ArrayList<>(slices);
    next.add(slice);
    return List.copyOf(next);
  }

  /** Scheduler-side state of one order. Slices are only replaced under the tick lock. */
  private static final class AlgoExecution {
    private final ReentrantLock tickLock = new ReentrantLock();
    private final String orderId;
    private final AlgorithmType algorithmType;
    private final BigDecimal arrivalPrice;
    private volatile AlgorithmParams params;
    private volatile RoutingConfig routing;
    private volatile List<OrderSlice> slices;
    private volatile AlgoState state = AlgoState.RUNNING;
    private volatile ScheduledFuture<?> task;
    private long carry;

    private AlgoExecution(
        String orderId,
        AlgorithmType algorithmType,
        AlgorithmParams params,
        RoutingConfig routing,
        List<OrderSlice> slices,
        BigDecimal arrivalPrice) {
      this.orderId = orderId;
      this.algorithmType = algorithmType;
      this.params = params;
      this.routing = routing;
      this.slices = List.copyOf(slices);
      this.arrivalPrice = arrivalPrice;
    }

    private boolean isFinished() {
      return state == AlgoState.COMPLETED || state == AlgoState.CANCELED;
    }

    private void replace(int index, OrderSlice slice) {
      List<OrderSlice> next = new ArrayList<>(slices);
      next.set(index, slice);
      slices = List.copyOf(next);
    }
  }
}
