package com.smartexec.worker.expiry;

import com.smartexec.domain.orders.Order;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** Periodic sweep that expires DAY orders after the session close and GTD orders past expiry. */
public class OrderExpiryScheduler {
  private static final Logger log = LoggerFactory.getLogger(OrderExpiryScheduler.class);

  private final OrderLifecycleService lifecycle;
  private final Clock clock;

  public OrderExpiryScheduler(OrderLifecycleService lifecycle, Clock clock) {
    this.lifecycle = lifecycle;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${worker.expiry.fixed-delay:PT30S}",
      initialDelayString = "${worker.expiry.initial-delay:PT30S}")
  public void expireDueOrders() {
    List<Order> expired = lifecycle.expire(clock.instant());
    if (expired.isEmpty()) {
      return;
    }
    log.info(
        "Expiry sweep completed expired={} orderIds={}",
        expired.size(),
        expired.stream().map(Order::orderId).toList());
  }
}
