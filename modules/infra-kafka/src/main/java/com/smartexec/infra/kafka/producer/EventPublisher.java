package com.smartexec.infra.kafka.producer;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

/** Publishes an envelope keyed by {@link EventEnvelope#key()}. */
public interface EventPublisher {
  <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, EventEnvelope<T> envelope);
}
