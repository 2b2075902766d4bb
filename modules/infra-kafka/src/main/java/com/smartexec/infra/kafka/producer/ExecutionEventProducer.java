package com.smartexec.infra.kafka.producer;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import com.smartexec.infra.kafka.contract.EventTypes;
import com.smartexec.infra.kafka.contract.payload.ExecutionRecordedV1;
import com.smartexec.infra.kafka.topics.TopicNames;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public class ExecutionEventProducer {
  private static final int EVENT_VERSION_V1 = 1;

  private final EventPublisher eventPublisher;
  private final String producerName;

  public ExecutionEventProducer(EventPublisher eventPublisher, String producerName) {
    this.eventPublisher = eventPublisher;
    this.producerName = producerName;
  }

  /** The venue execution id is carried as causation id for downstream dedup. */
  public CompletableFuture<SendResult<String, String>> publishExecutionRecorded(
      ExecutionRecordedV1 payload) {
    if (payload.orderId() == null || payload.orderId().isBlank()) {
      throw new IllegalArgumentException("payload.orderId must not be blank");
    }
    EventEnvelope<ExecutionRecordedV1> envelope =
        EventEnvelope.of(
            EventTypes.EXECUTION_RECORDED,
            EVENT_VERSION_V1,
            payload.executedAt(),
            producerName,
            payload.orderId(),
            payload.executionId(),
            payload);
    return eventPublisher.publish(TopicNames.EXECUTIONS_RECORDED_V1, envelope);
  }
}
