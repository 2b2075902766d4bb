package com.smartexec.infra.kafka.producer;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import com.smartexec.infra.kafka.contract.EventTypes;
import com.smartexec.infra.kafka.contract.payload.OrderUpdatedV1;
import com.smartexec.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class OrderEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public OrderEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  /** Keyed by the parent order id when present, so slices share their parent's partition. */
  public CompletableFuture<SendResult<String, String>> publishOrderUpdated(
      OrderUpdatedV1 payload) {
    String key = partitionKey(payload.parentOrderId(), payload.orderId());
    EventEnvelope<OrderUpdatedV1> envelope =
        EventEnvelope.of(
            EventTypes.ORDER_UPDATED,
            EVENT_VERSION_V1,
            payload.updatedAt(),
            producerName,
            key,
            null,
            payload);
    return eventPublisher.publish(TopicNames.ORDERS_UPDATED_V1, envelope);
  }

  static String partitionKey(String parentOrderId, String orderId) {
    if (parentOrderId != null && !parentOrderId.isBlank()) {
      return parentOrderId;
    }
    if (orderId == null || orderId.isBlank()) {
      throw new IllegalArgumentException("payload.orderId must not be blank");
    }
    return orderId;
  }
}
