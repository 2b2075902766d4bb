package com.smartexec.worker.events;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.smartexec.domain.orders.ExecutionReport;
import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderEvent;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderSide;
import com.smartexec.infra.kafka.contract.payload.ExecutionRecordedV1;
import com.smartexec.infra.kafka.contract.payload.OrderUpdatedV1;
import com.smartexec.infra.kafka.producer.ExecutionEventProducer;
import com.smartexec.infra.kafka.producer.KafkaPublishException;
import com.smartexec.infra.kafka.producer.OrderEventProducer;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.SendResult;

@ExtendWith(MockitoExtension.class)
class KafkaOrderEventBridgeTest {
  private static final Instant NOW = Instant.parse("2026-03-02T14:30:00Z");

  @Mock private OrderEventProducer orderEventProducer;

  @Mock private ExecutionEventProducer executionEventProducer;

  private KafkaOrderEventBridge bridge;

  @BeforeEach
  void setUp() {
    bridge = new KafkaOrderEventBridge(orderEventProducer, executionEventProducer);
  }

  @Test
  void shouldPublishTransitionWithPreviousStatus() {
    when(orderEventProducer.publishOrderUpdated(any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    Order pending = pendingOrder();
    Order accepted = pending.apply(OrderEvent.ACCEPT, NOW.plusSeconds(1));

    bridge.onOrderUpdated(pending, accepted, "accepted");

    ArgumentCaptor<OrderUpdatedV1> captor = ArgumentCaptor.forClass(OrderUpdatedV1.class);
    verify(orderEventProducer).publishOrderUpdated(captor.capture());
    OrderUpdatedV1 payload = captor.getValue();
    assertEquals("ord-1", payload.orderId());
    assertEquals("PENDING", payload.previousStatus());
    assertEquals("NEW", payload.status());
    assertEquals("accepted", payload.reason());
    assertEquals(1000L, payload.remainingQuantity());
    assertEquals(new BigDecimal("150.05"), payload.limitPrice());
    assertNull(payload.averagePrice());
    assertEquals(NOW.plusSeconds(1), payload.updatedAt());
  }

  @Test
  void shouldPublishAppliedFillWithOrderTotals() {
    when(executionEventProducer.publishExecutionRecorded(any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    ExecutionReport report =
        new ExecutionReport(
            "exec-1", "ord-1", null, "NYSE", 600L, new BigDecimal("150.00"), NOW.plusSeconds(2));
    Order filled =
        pendingOrder()
            .apply(OrderEvent.ACCEPT, NOW.plusSeconds(1))
            .applyFill(report.quantity(), report.price(), report.timestamp());

    bridge.onExecutionApplied(filled, report);

    ArgumentCaptor<ExecutionRecordedV1> captor =
        ArgumentCaptor.forClass(ExecutionRecordedV1.class);
    verify(executionEventProducer).publishExecutionRecorded(captor.capture());
    ExecutionRecordedV1 payload = captor.getValue();
    assertEquals("exec-1", payload.executionId());
    assertEquals("NYSE", payload.venue());
    assertEquals(600L, payload.quantity());
    assertEquals(600L, payload.orderFilledQuantity());
    assertEquals("PARTIALLY_FILLED", payload.orderStatus());
    assertEquals(NOW.plusSeconds(2), payload.executedAt());
  }

  @Test
  void shouldSwallowAsyncPublishFailure() {
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(
        new KafkaPublishException(
            "execution.orders.updated.v1", "ord-1", "OrderUpdated", "broker down", null));
    when(orderEventProducer.publishOrderUpdated(any())).thenReturn(failed);

    assertDoesNotThrow(() -> bridge.onOrderUpdated(null, pendingOrder(), "created"));
  }

  private static Order pendingOrder() {
    return Order.createPending(
        "ord-1",
        OrderRequest.limit("client-1", "AAPL", OrderSide.BUY, 1000L, new BigDecimal("150.05")),
        NOW);
  }
}
