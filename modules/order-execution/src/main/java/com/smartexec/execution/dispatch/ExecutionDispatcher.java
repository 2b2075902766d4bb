package com.smartexec.execution.dispatch;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderDomainException;
import com.smartexec.execution.lifecycle.ExecutionApplyResult;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import com.smartexec.execution.marketdata.OrderBookSnapshot;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import com.smartexec.execution.observability.ExecutionTelemetry;
import com.smartexec.execution.routing.RoutingConfig;
import com.smartexec.execution.routing.RoutingPlan;
import com.smartexec.execution.routing.SmartOrderRouter;
import com.smartexec.execution.routing.VenueRoute;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes a routing plan against venues concurrently. A failed venue never aborts its
 * siblings; each one gets a single fallback plan over the venues that have not failed, and
 * failures of that fallback are reported, not retried.
 */
public class ExecutionDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

  private final VenueExecutionEndpoint endpoint;
  private final VenueQuoteSource quoteSource;
  private final SmartOrderRouter router;
  private final OrderLifecycleService lifecycle;
  private final ExecutorService executor;
  private final Duration venueTimeout;
  private final ExecutionTelemetry telemetry;

  public ExecutionDispatcher(
      VenueExecutionEndpoint endpoint,
      VenueQuoteSource quoteSource,
      SmartOrderRouter router,
      OrderLifecycleService lifecycle,
      ExecutorService executor,
      Duration venueTimeout,
      ExecutionTelemetry telemetry) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint must not be null");
    this.quoteSource = Objects.requireNonNull(quoteSource, "quoteSource must not be null");
    this.router = Objects.requireNonNull(router, "router must not be null");
    this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle must not be null");
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    this.venueTimeout = venueTimeout == null ? Duration.ZERO : venueTimeout;
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
  }

  public DispatchResult dispatch(Order order, RoutingPlan plan, RoutingConfig config) {
    return dispatch(order.orderId(), null, order, plan, config);
  }

  /**
   * Dispatches {@code plan} for {@code order}, which may be a slice snapshot. Fills are applied
   * to {@code ledgerOrderId}.
   */
  public DispatchResult dispatch(
      String ledgerOrderId, String sliceId, Order order, RoutingPlan plan, RoutingConfig config) {
    Objects.requireNonNull(plan, "plan must not be null");
    if (plan.isEmpty()) {
      return DispatchResult.empty(plan.requestedQuantity());
    }
    if (!lifecycle.tryBeginActivity(ledgerOrderId)) {
      log.info(
          "Dispatch skipped orderId={} status={} requested={}",
          ledgerOrderId,
          lifecycle.get(ledgerOrderId).status(),
          plan.requestedQuantity());
      return DispatchResult.empty(plan.requestedQuantity());
    }

    try {
      List<VenueCall> calls = executeAll(ledgerOrderId, sliceId, order, plan.routes(), false);

      Set<String> failedVenues = new LinkedHashSet<>();
      for (VenueCall call : calls) {
        if (call.failed()) {
          failedVenues.add(call.route().venue());
        }
      }

      List<VenueCall> fallbackCalls = new ArrayList<>();
      for (VenueCall call : calls) {
        if (!call.failed()) {
          continue;
        }
        RoutingPlan fallbackPlan =
            handleRoutingFailure(order, call.route(), call.error(), failedVenues, config);
        if (fallbackPlan.isEmpty()) {
          telemetry.onFallback(call.route().venue(), "no_liquidity");
          continue;
        }
        List<VenueCall> attempted =
            executeAll(ledgerOrderId, sliceId, order, fallbackPlan.routes(), true);
        boolean anyFilled = attempted.stream().anyMatch(attempt -> !attempt.failed());
        telemetry.onFallback(call.route().venue(), anyFilled ? "success" : "failure");
        for (VenueCall attempt : attempted) {
          if (attempt.failed()) {
            failedVenues.add(attempt.route().venue());
          }
        }
        fallbackCalls.addAll(attempted);
      }

      List<VenueCall> allCalls = new ArrayList<>(calls);
      allCalls.addAll(fallbackCalls);
      return collect(plan.requestedQuantity(), allCalls);
    } finally {
      lifecycle.endActivity(ledgerOrderId);
    }
  }

  /**
   * Builds the one fallback plan for a failed route from fresh quotes, excluding every venue
   * that has failed so far in this dispatch.
   */
  public RoutingPlan handleRoutingFailure(
      Order order,
      VenueRoute failedRoute,
      Throwable error,
      Set<String> excludedVenues,
      RoutingConfig config) {
    Set<String> excluded = new LinkedHashSet<>(excludedVenues);
    excluded.add(failedRoute.venue());
    List<String> candidates =
        config.venues().stream().filter(venue -> !excluded.contains(venue)).toList();
    log.warn(
        "Venue failed, routing fallback orderId={} venue={} qty={} candidates={} reason={}",
        order.orderId(),
        failedRoute.venue(),
        failedRoute.quantity(),
        candidates,
        error == null ? "unknown" : error.getMessage());
    if (candidates.isEmpty()) {
      return RoutingPlan.empty(order.orderId(), failedRoute.quantity());
    }
    Map<String, OrderBookSnapshot> quotes = quoteSource.quotes(order.symbol(), candidates);
    return router.route(order, failedRoute.quantity(), quotes, config, excluded);
  }

  private List<VenueCall> executeAll(
      String ledgerOrderId,
      String sliceId,
      Order order,
      List<VenueRoute> routes,
      boolean fallback) {
    List<CompletableFuture<VenueCall>> futures = new ArrayList<>(routes.size());
    for (VenueRoute route : routes) {
      VenueExecutionRequest request =
          new VenueExecutionRequest(
              UUID.randomUUID().toString(),
              ledgerOrderId,
              sliceId,
              route.venue(),
              order.symbol(),
              order.side(),
              order.orderType(),
              route.quantity(),
              order.effectiveLimitPrice(),
              route.expectedPrice());
      long started = System.nanoTime();
      CompletableFuture<ExecutionReport> call =
          applyTimeout(CompletableFuture.supplyAsync(() -> endpoint.execute(request), executor));
      futures.add(
          call.handle(
              (report, throwable) -> {
                Throwable cause = throwable == null ? null : unwrap(throwable);
                telemetry.onVenueCall(
                    route.venue(), outcomeOf(cause), System.nanoTime() - started);
                return new VenueCall(route, report, cause, fallback);
              }));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
    return futures.stream().map(CompletableFuture::join).toList();
  }

  private DispatchResult collect(long requestedQuantity, List<VenueCall> calls) {
    List<ExecutionReport> applied = new ArrayList<>();
    List<ExecutionReport> rejected = new ArrayList<>();
    List<VenueFailure> failures = new ArrayList<>();
    long totalFilled = 0L;
    for (VenueCall call : calls) {
      if (call.failed()) {
        failures.add(
            new VenueFailure(
                call.route().venue(),
                call.route().quantity(),
                describe(call.error()),
                call.fallback()));
        continue;
      }
      ExecutionReport report = call.report();
      try {
        if (lifecycle.applyExecution(report) == ExecutionApplyResult.APPLIED) {
          applied.add(report);
          totalFilled += report.quantity();
        }
      } catch (OrderDomainException ex) {
        log.warn(
            "Venue fill not applied orderId={} executionId={} venue={} reason={}",
            report.orderId(),
            report.executionId(),
            report.venue(),
            ex.getMessage());
        rejected.add(report);
      }
    }
    log.info(
        "Dispatch completed requested={} filled={} reports={} failures={}",
        requestedQuantity,
        totalFilled,
        applied.size(),
        failures.size());
    return new DispatchResult(applied, failures, rejected, totalFilled, requestedQuantity);
  }

  private CompletableFuture<ExecutionReport> applyTimeout(
      CompletableFuture<ExecutionReport> future) {
    if (venueTimeout.isZero() || venueTimeout.isNegative()) {
      return future;
    }
    return future.orTimeout(venueTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  private static String outcomeOf(Throwable cause) {
    if (cause == null) {
      return "success";
    }
    return cause instanceof TimeoutException ? "timeout" : "failure";
  }

  private String describe(Throwable cause) {
    if (cause == null) {
      return "venue returned no fill";
    }
    if (cause instanceof TimeoutException) {
      return "timed out after " + venueTimeout.toMillis() + "ms";
    }
    return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
  }

  private record VenueCall(
      VenueRoute route, ExecutionReport report, Throwable error, boolean fallback) {
    boolean failed() {
      return error != null || report == null;
    }
  }
}
