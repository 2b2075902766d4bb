package com.smartexec.worker.expiry;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderSide;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderExpirySchedulerTest {
  private static final Instant NOW = Instant.parse("2026-03-02T21:00:00Z");

  @Mock private OrderLifecycleService lifecycle;

  @Test
  void shouldSweepWithCurrentClockInstant() {
    Order expired =
        Order.createPending(
            "ord-1",
            OrderRequest.limit("client-1", "AAPL", OrderSide.BUY, 100L, new BigDecimal("150")),
            NOW.minusSeconds(3600));
    when(lifecycle.expire(NOW)).thenReturn(List.of(expired));

    new OrderExpiryScheduler(lifecycle, Clock.fixed(NOW, ZoneOffset.UTC)).expireDueOrders();

    verify(lifecycle).expire(NOW);
  }

  @Test
  void shouldToleratePassWithNothingToExpire() {
    when(lifecycle.expire(NOW)).thenReturn(List.of());

    new OrderExpiryScheduler(lifecycle, Clock.fixed(NOW, ZoneOffset.UTC)).expireDueOrders();

    verify(lifecycle).expire(NOW);
  }
}
