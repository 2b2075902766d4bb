package com.smartexec.infra.kafka.observability;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, String eventType, long durationNanos);

  void onPublishFailure(String topic, String eventType, Throwable error);
}
