package com.smartexec.execution.lifecycle;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.InvalidTransitionException;
import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderChanges;
import com.smartexec.domain.orders.OrderDomainException;
import com.smartexec.domain.orders.OrderEvent;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderStatus;
import com.smartexec.domain.orders.OrderValidationException;
import com.smartexec.domain.orders.TerminalOrderException;
import com.smartexec.domain.orders.TimeInForce;
import com.smartexec.execution.ledger.AuditEventType;
import com.smartexec.execution.ledger.LedgerEntry;
import com.smartexec.execution.ledger.OrderAuditEvent;
import com.smartexec.execution.ledger.OrderAuditRepository;
import com.smartexec.execution.ledger.OrderLedger;
import com.smartexec.execution.observability.ExecutionTelemetry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole writer of order state. Every operation runs under the ledger lock of the order it
 * touches; listeners are notified once the lock is released.
 */
public class OrderLifecycleService {
  private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

  private final OrderLedger ledger;
  private final OrderAuditRepository auditRepository;
  private final List<OrderEventListener> listeners;
  private final ExecutionTelemetry telemetry;
  private final TradingSession session;
  private final Clock clock;
  private final Supplier<String> orderIdGenerator;

  public OrderLifecycleService(
      OrderLedger ledger,
      OrderAuditRepository auditRepository,
      List<OrderEventListener> listeners,
      ExecutionTelemetry telemetry,
      TradingSession session,
      Clock clock,
      Supplier<String> orderIdGenerator) {
    this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
    this.auditRepository =
        Objects.requireNonNull(auditRepository, "auditRepository must not be null");
    this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.session = Objects.requireNonNull(session, "session must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.orderIdGenerator =
        Objects.requireNonNull(orderIdGenerator, "orderIdGenerator must not be null");
  }

  public Order create(OrderRequest request) {
    if (request == null) {
      throw new OrderValidationException("request must not be null");
    }
    Instant now = clock.instant();
    Order order = ledger.register(Order.createPending(orderIdGenerator.get(), request, now));
    auditRepository.append(
        new OrderAuditEvent(
            order.orderId(),
            AuditEventType.CREATED,
            null,
            order.status(),
            "quantity=" + order.quantity(),
            now));
    telemetry.onOrderTransition(null, order.status());
    log.info(
        "Order created orderId={} clientOrderId={} symbol={} side={} type={} qty={} algorithm={}",
        order.orderId(),
        order.clientOrderId(),
        order.symbol(),
        order.side(),
        order.orderType(),
        order.quantity(),
        order.algorithmType());
    publish(List.of(new Change(null, order, "created")));
    return order;
  }

  public Order accept(String orderId) {
    return transition(orderId, OrderEvent.ACCEPT, AuditEventType.ACCEPTED, "accepted");
  }

  public Order reject(String orderId, String reason) {
    return transition(orderId, OrderEvent.REJECT, AuditEventType.REJECTED, reason);
  }

  public ExecutionApplyResult applyExecution(ExecutionReport report) {
    Objects.requireNonNull(report, "report must not be null");
    List<Change> changes = new ArrayList<>();
    ExecutionApplyResult result =
        ledger.update(
            report.orderId(),
            entry -> {
              if (entry.hasExecution(report.executionId())) {
                return ExecutionApplyResult.DUPLICATE;
              }
              Order current = entry.order();
              if (current.isTerminal()) {
                throw new TerminalOrderException(
                    current.orderId(), current.status(), "apply execution to");
              }
              if (!current.status().isFillable()) {
                throw new OrderValidationException(
                    "Order "
                        + current.orderId()
                        + " cannot take executions while "
                        + current.status());
              }
              Order next;
              try {
                next = current.applyFill(report.quantity(), report.price(), clock.instant());
              } catch (OrderDomainException ex) {
                log.warn(
                    "Execution rejected orderId={} executionId={} venue={} qty={} status={} reason={}",
                    current.orderId(),
                    report.executionId(),
                    report.venue(),
                    report.quantity(),
                    current.status(),
                    ex.getMessage());
                throw ex;
              }
              entry.recordExecution(report);
              commit(
                  entry,
                  next,
                  AuditEventType.EXECUTION_APPLIED,
                  "executionId="
                      + report.executionId()
                      + " venue="
                      + report.venue()
                      + " qty="
                      + report.quantity()
                      + " price="
                      + report.price(),
                  changes);
              return ExecutionApplyResult.APPLIED;
            });

    if (result == ExecutionApplyResult.DUPLICATE) {
      telemetry.onDuplicateExecution(report.venue());
      log.info(
          "Duplicate execution ignored orderId={} executionId={} venue={}",
          report.orderId(),
          report.executionId(),
          report.venue());
      return result;
    }
    telemetry.onExecutionApplied(report.venue(), report.quantity());
    Order updated = changes.get(changes.size() - 1).current();
    log.info(
        "Execution applied orderId={} executionId={} venue={} qty={} price={} filled={} remaining={} status={}",
        updated.orderId(),
        report.executionId(),
        report.venue(),
        report.quantity(),
        report.price(),
        updated.filledQuantity(),
        updated.remainingQuantity(),
        updated.status());
    publish(changes);
    for (OrderEventListener listener : listeners) {
      try {
        listener.onExecutionApplied(updated, report);
      } catch (RuntimeException ex) {
        log.warn(
            "Order event listener failed orderId={} executionId={} listener={}",
            updated.orderId(),
            report.executionId(),
            listener.getClass().getSimpleName(),
            ex);
      }
    }
    return result;
  }

  public CancelResult cancel(String orderId, String reason) {
    List<Change> changes = new ArrayList<>();
    CancelResult result =
        ledger.update(
            orderId,
            entry -> {
              Order current = entry.order();
              if (current.isTerminal() || current.status() == OrderStatus.PENDING_CANCEL) {
                log.info(
                    "Cancel ignored orderId={} status={} reason={}",
                    orderId,
                    current.status(),
                    reason);
                return new CancelResult(current, false);
              }
              Order pending = applyEvent(current, OrderEvent.CANCEL_REQUEST);
              commit(entry, pending, AuditEventType.CANCEL_REQUESTED, reason, changes);
              if (entry.outstandingActivity() == 0) {
                confirmCancel(entry, changes);
              } else {
                log.info(
                    "Cancel pending orderId={} outstandingActivity={}",
                    orderId,
                    entry.outstandingActivity());
              }
              return new CancelResult(entry.order(), true);
            });
    publish(changes);
    return result;
  }

  public BulkCancelResult cancelAllForSymbol(String symbol, String reason) {
    List<String> cancelled = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    for (Order order : ledger.snapshot()) {
      if (!order.symbol().equals(symbol)
          || order.isTerminal()
          || order.status() == OrderStatus.PENDING_CANCEL) {
        continue;
      }
      try {
        if (cancel(order.orderId(), reason).cancelled()) {
          cancelled.add(order.orderId());
        }
      } catch (OrderDomainException ex) {
        log.warn(
            "Bulk cancel failed orderId={} symbol={} reason={}",
            order.orderId(),
            symbol,
            ex.getMessage());
        failed.add(order.orderId());
      }
    }
    log.info(
        "Bulk cancel completed symbol={} cancelled={} failed={}",
        symbol,
        cancelled.size(),
        failed.size());
    return new BulkCancelResult(cancelled, failed);
  }

  /** Moves the order to PENDING_REPLACE with the amended quantity and/or limit price. */
  public Order modify(String orderId, OrderChanges orderChanges) {
    Objects.requireNonNull(orderChanges, "orderChanges must not be null");
    List<Change> changes = new ArrayList<>();
    Order result =
        ledger.update(
            orderId,
            entry -> {
              Order current = entry.order();
              if (current.isTerminal()) {
                throw new TerminalOrderException(orderId, current.status(), "modify");
              }
              Order requested = applyEvent(current, OrderEvent.REPLACE_REQUEST);
              Order amended = requested.withReplacement(orderChanges, clock.instant());
              commit(
                  entry,
                  amended,
                  AuditEventType.REPLACE_REQUESTED,
                  describe(orderChanges),
                  changes);
              return amended;
            });
    publish(changes);
    return result;
  }

  /** Confirms a pending replace and restates the order as NEW or PARTIALLY_FILLED. */
  public Order confirmReplace(String orderId) {
    List<Change> changes = new ArrayList<>();
    Order result =
        ledger.update(
            orderId,
            entry -> {
              Order current = entry.order();
              if (current.isTerminal()) {
                throw new TerminalOrderException(orderId, current.status(), "confirm replace of");
              }
              Order replaced = applyEvent(current, OrderEvent.REPLACE_CONFIRM);
              commit(entry, replaced, AuditEventType.REPLACED, "replace confirmed", changes);
              Order restated = replaced.restate(clock.instant());
              commit(entry, restated, AuditEventType.RESTATED, "restated", changes);
              return restated;
            });
    publish(changes);
    return result;
  }

  public List<Order> expire(Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    List<Order> expired = new ArrayList<>();
    for (Order candidate : ledger.snapshot()) {
      if (!candidate.status().isWorking() || !isExpired(candidate, now)) {
        continue;
      }
      List<Change> changes = new ArrayList<>();
      try {
        Optional<Order> result =
            ledger.update(
                candidate.orderId(),
                entry -> {
                  Order current = entry.order();
                  if (!current.status().isWorking() || !isExpired(current, now)) {
                    return Optional.<Order>empty();
                  }
                  Order next = applyEvent(current, OrderEvent.EXPIRE);
                  commit(
                      entry,
                      next,
                      AuditEventType.EXPIRED,
                      current.timeInForce() + " expiry",
                      changes);
                  return Optional.of(next);
                });
        result.ifPresent(expired::add);
      } catch (OrderDomainException ex) {
        log.warn("Order expiry failed orderId={} reason={}", candidate.orderId(), ex.getMessage());
      }
      publish(changes);
    }
    if (!expired.isEmpty()) {
      log.info("Expired orders count={} asOf={}", expired.size(), now);
    }
    return expired;
  }

  /**
   * Registers one unit of venue activity if the order may still be dispatched. Returns false,
   * without registering anything, once the order is pending cancel, terminal or not yet
   * accepted.
   */
  public boolean tryBeginActivity(String orderId) {
    return ledger.update(
        orderId,
        entry -> {
          if (!entry.order().status().isDispatchable()) {
            return false;
          }
          entry.beginActivity();
          return true;
        });
  }

  /** Releases one unit of venue activity; a pending cancel is confirmed once none is left. */
  public void endActivity(String orderId) {
    List<Change> changes = new ArrayList<>();
    ledger.update(
        orderId,
        entry -> {
          int left = entry.endActivity();
          if (left == 0 && entry.order().status() == OrderStatus.PENDING_CANCEL) {
            confirmCancel(entry, changes);
          }
          return left;
        });
    publish(changes);
  }

  public Optional<Order> find(String orderId) {
    return ledger.find(orderId);
  }

  public Order get(String orderId) {
    return ledger.get(orderId);
  }

  public List<OrderAuditEvent> history(String orderId) {
    ledger.get(orderId);
    return auditRepository.findByOrderId(orderId);
  }

  public List<ExecutionReport> executions(String orderId) {
    return ledger.update(orderId, LedgerEntry::executions);
  }

  private Order transition(
      String orderId, OrderEvent event, AuditEventType auditEventType, String detail) {
    List<Change> changes = new ArrayList<>();
    Order result =
        ledger.update(
            orderId,
            entry -> {
              Order current = entry.order();
              if (current.isTerminal()) {
                throw new TerminalOrderException(
                    orderId, current.status(), event.name().toLowerCase());
              }
              Order next = applyEvent(current, event);
              commit(entry, next, auditEventType, detail, changes);
              return next;
            });
    publish(changes);
    return result;
  }

  private void confirmCancel(LedgerEntry entry, List<Change> changes) {
    Order confirmed = applyEvent(entry.order(), OrderEvent.CANCEL_CONFIRM);
    commit(entry, confirmed, AuditEventType.CANCELED, "cancel confirmed", changes);
  }

  private Order applyEvent(Order current, OrderEvent event) {
    try {
      return current.apply(event, clock.instant());
    } catch (InvalidTransitionException ex) {
      log.warn(
          "Invalid order transition orderId={} status={} event={}",
          current.orderId(),
          current.status(),
          event);
      throw ex;
    }
  }

  private void commit(
      LedgerEntry entry,
      Order next,
      AuditEventType auditEventType,
      String detail,
      List<Change> changes) {
    Order previous = entry.order();
    entry.replace(next);
    auditRepository.append(
        new OrderAuditEvent(
            next.orderId(),
            auditEventType,
            previous.status(),
            next.status(),
            detail,
            next.updatedAt()));
    if (previous.status() != next.status()) {
      telemetry.onOrderTransition(previous.status(), next.status());
      log.info(
          "Order transition orderId={} from={} to={} event={} detail={}",
          next.orderId(),
          previous.status(),
          next.status(),
          auditEventType,
          detail);
    }
    changes.add(new Change(previous, next, detail));
  }

  private boolean isExpired(Order order, Instant now) {
    if (order.timeInForce() == TimeInForce.GTD) {
      return order.expireAt() != null && !now.isBefore(order.expireAt());
    }
    if (order.timeInForce() == TimeInForce.DAY) {
      return session.isClosedFor(order.createdAt(), now);
    }
    return false;
  }

  private void publish(List<Change> changes) {
    for (Change change : changes) {
      for (OrderEventListener listener : listeners) {
        try {
          listener.onOrderUpdated(change.previous(), change.current(), change.reason());
        } catch (RuntimeException ex) {
          log.warn(
              "Order event listener failed orderId={} status={} listener={}",
              change.current().orderId(),
              change.current().status(),
              listener.getClass().getSimpleName(),
              ex);
        }
      }
    }
  }

  private static String describe(OrderChanges changes) {
    StringBuilder detail = new StringBuilder();
    if (changes.quantity() != null) {
      detail.append("quantity=").append(changes.quantity());
    }
    if (changes.limitPrice() != null) {
      if (detail.length() > 0) {
        detail.append(' ');
      }
      detail.append("limitPrice=").append(changes.limitPrice());
    }
    if (changes.reason() != null && !changes.reason().isBlank()) {
      detail.append(" reason=").append(changes.reason());
    }
    return detail.toString();
  }

  private record Change(Order previous, Order current, String reason) {}
}
