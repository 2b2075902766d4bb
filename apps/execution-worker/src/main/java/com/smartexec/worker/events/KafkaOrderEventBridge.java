package com.smartexec.worker.events;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;
import com.smartexec.execution.lifecycle.OrderEventListener;
import com.smartexec.infra.kafka.contract.payload.ExecutionRecordedV1;
import com.smartexec.infra.kafka.contract.payload.OrderUpdatedV1;
import com.smartexec.infra.kafka.producer.ExecutionEventProducer;
import com.smartexec.infra.kafka.producer.OrderEventProducer;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes committed order transitions and applied fills to Kafka for allocation, settlement
 * and analytics. Publishing is asynchronous; a failed send is logged and never reaches the
 * ledger.
 */
public class KafkaOrderEventBridge implements OrderEventListener {
  private static final Logger log = LoggerFactory.getLogger(KafkaOrderEventBridge.class);

  private final OrderEventProducer orderEventProducer;
  private final ExecutionEventProducer executionEventProducer;

  public KafkaOrderEventBridge(
      OrderEventProducer orderEventProducer, ExecutionEventProducer executionEventProducer) {
    this.orderEventProducer = orderEventProducer;
    this.executionEventProducer = executionEventProducer;
  }

  @Override
  public void onOrderUpdated(Order previous, Order current, String reason) {
    OrderUpdatedV1 payload = toOrderUpdated(previous, current, reason);
    logFailure(
        orderEventProducer.publishOrderUpdated(payload), "OrderUpdated", current.orderId());
  }

  @Override
  public void onExecutionApplied(Order order, ExecutionReport report) {
    ExecutionRecordedV1 payload = toExecutionRecorded(order, report);
    logFailure(
        executionEventProducer.publishExecutionRecorded(payload),
        "ExecutionRecorded",
        order.orderId());
  }

  static OrderUpdatedV1 toOrderUpdated(Order previous, Order current, String reason) {
    return new OrderUpdatedV1(
        current.orderId(),
        current.clientOrderId(),
        current.parentOrderId(),
        current.account(),
        current.symbol(),
        current.side().name(),
        current.orderType().name(),
        previous == null ? null : previous.status().name(),
        current.status().name(),
        reason,
        current.quantity(),
        current.filledQuantity(),
        current.remainingQuantity(),
        current.effectiveLimitPrice(),
        current.filledQuantity() == 0 ? null : current.averagePrice(),
        current.algorithmType() == null ? null : current.algorithmType().name(),
        current.updatedAt());
  }

  static ExecutionRecordedV1 toExecutionRecorded(Order order, ExecutionReport report) {
    return new ExecutionRecordedV1(
        report.executionId(),
        report.orderId(),
        report.sliceId(),
        order.account(),
        order.symbol(),
        order.side().name(),
        report.venue(),
        report.quantity(),
        report.price(),
        order.filledQuantity(),
        order.averagePrice(),
        order.status().name(),
        report.timestamp());
  }

  private static void logFailure(CompletableFuture<?> future, String eventType, String orderId) {
    future.whenComplete(
        (ignored, throwable) -> {
          if (throwable != null) {
            log.warn(
                "Downstream event not published eventType={} orderId={} reason={}",
                eventType,
                orderId,
                throwable.getMessage());
          }
        });
  }
}
