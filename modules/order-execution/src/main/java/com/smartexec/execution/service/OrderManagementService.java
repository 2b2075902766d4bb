package com.smartexec.execution.service;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderChanges;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.execution.algo.AlgoAdjustment;
import com.smartexec.execution.algo.AlgoProgress;
import com.smartexec.execution.algo.AlgorithmicScheduler;
import com.smartexec.execution.algo.OrderSlice;
import com.smartexec.execution.compliance.ComplianceCheck;
import com.smartexec.execution.compliance.ComplianceGate;
import com.smartexec.execution.compliance.ComplianceRejectionException;
import com.smartexec.execution.compliance.ComplianceResult;
import com.smartexec.execution.dispatch.DispatchResult;
import com.smartexec.execution.dispatch.ExecutionDispatcher;
import com.smartexec.execution.lifecycle.BulkCancelResult;
import com.smartexec.execution.lifecycle.CancelResult;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import com.smartexec.execution.marketdata.OrderBookSnapshot;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import com.smartexec.execution.observability.ExecutionTelemetry;
import com.smartexec.execution.routing.RoutingConfig;
import com.smartexec.execution.routing.RoutingPlan;
import com.smartexec.execution.routing.SmartOrderRouter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Entry point for order flow: compliance, acceptance, then routing or algorithmic scheduling. */
public class OrderManagementService {
  private static final Logger log = LoggerFactory.getLogger(OrderManagementService.class);

  private final OrderLifecycleService lifecycle;
  private final ComplianceGate complianceGate;
  private final VenueQuoteSource quoteSource;
  private final SmartOrderRouter router;
  private final ExecutionDispatcher dispatcher;
  private final AlgorithmicScheduler scheduler;
  private final RoutingConfig defaultRouting;
  private final ExecutionTelemetry telemetry;

  public OrderManagementService(
      OrderLifecycleService lifecycle,
      ComplianceGate complianceGate,
      VenueQuoteSource quoteSource,
      SmartOrderRouter router,
      ExecutionDispatcher dispatcher,
      AlgorithmicScheduler scheduler,
      RoutingConfig defaultRouting,
      ExecutionTelemetry telemetry) {
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
    this.complianceGate = Objects.requireNonNull(complianceGate, "complianceGate must not be null");
    this.quoteSource = Objects.requireNonNull(quoteSource, "quoteSource must not be null");
    this.router = Objects.requireNonNull(router, "router must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    this.defaultRouting = Objects.requireNonNull(defaultRouting, "defaultRouting must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  public OrderSubmission submit(OrderRequest request) {
    return submit(request, defaultRouting);
  }

  /**
   * Creates the order and runs it through compliance. A blocked order is rejected and a
   * {@link ComplianceRejectionException} is thrown; otherwise the order is accepted and either
   * dispatched right away or handed to the algorithmic scheduler.
   */
  public OrderSubmission submit(OrderRequest request, RoutingConfig routing) {
    Objects.requireNonNull(routing, "routing must not be null");
    Order created = lifecycle.create(request);
    ComplianceResult compliance = complianceGate.check(created);
    if (compliance.isBlocked()) {
      telemetry.onComplianceRejected(created.symbol());
      lifecycle.reject(created.orderId(), rejectionReason(compliance));
      throw new ComplianceRejectionException(created.orderId(), compliance);
    }
    List<ComplianceCheck> warnings = compliance.warnings();
    if (!warnings.isEmpty()) {
      log.info(
          "Compliance warnings orderId={} checks={}",
          created.orderId(),
          warnings.stream().map(ComplianceCheck::name).toList());
    }

    Order accepted = lifecycle.accept(created.orderId());
    if (accepted.isAlgorithmic()) {
      List<OrderSlice> slices = scheduler.schedule(accepted);
      return new OrderSubmission(
          lifecycle.get(accepted.orderId()), warnings, DispatchResult.empty(0L), slices);
    }

    DispatchResult dispatch = routeAndDispatch(accepted, routing);
    return new OrderSubmission(lifecycle.get(accepted.orderId()), warnings, dispatch, List.of());
  }

  /** Cancels the order. Scheduled slices of an algorithmic order stop at the next tick. */
  public CancelResult cancel(String orderId, String reason) {
    return lifecycle.cancel(orderId, reason);
  }

  public BulkCancelResult cancelAllForSymbol(String symbol, String reason) {
    return lifecycle.cancelAllForSymbol(symbol, reason);
  }

  /**
   * Replaces quantity or limit price and routes what is left. Algorithmic orders are not
   * re-routed here; their scheduler sizes the next slices from the new remaining quantity.
   */
  public OrderModification modify(String orderId, OrderChanges changes) {
    lifecycle.modify(orderId, changes);
    Order replaced = lifecycle.confirmReplace(orderId);
    if (replaced.isAlgorithmic()
        || !replaced.status().isWorking()
        || replaced.remainingQuantity() <= 0) {
      return new OrderModification(replaced, DispatchResult.empty(0L));
    }
    DispatchResult dispatch = routeAndDispatch(replaced, defaultRouting);
    return new OrderModification(lifecycle.get(orderId), dispatch);
  }

  public AlgoProgress monitor(String orderId) {
    return scheduler.monitorProgress(orderId);
  }

  public void pause(String orderId, String reason) {
    scheduler.pause(orderId, reason);
  }

  public void resume(String orderId) {
    scheduler.resume(orderId);
  }

  public void adjust(String orderId, AlgoAdjustment adjustment) {
    scheduler.adjustParameters(orderId, adjustment);
  }

  private DispatchResult routeAndDispatch(Order order, RoutingConfig routing) {
    Map<String, OrderBookSnapshot> quotes = quoteSource.quotes(order.symbol(), routing.venues());
    RoutingPlan plan = router.route(order, quotes, routing);
    if (plan.isEmpty()) {
      log.warn(
          "No routable liquidity orderId={} symbol={} qty={}",
          order.orderId(),
          order.symbol(),
          order.remainingQuantity());
    }
    return dispatcher.dispatch(order, plan, routing);
  }

  private static String rejectionReason(ComplianceResult compliance) {
    return compliance.violations().stream()
        .map(ComplianceCheck::name)
        .collect(Collectors.joining(",", "compliance:", ""));
  }
}
