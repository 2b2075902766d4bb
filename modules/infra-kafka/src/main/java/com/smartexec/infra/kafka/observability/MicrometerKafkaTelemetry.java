package com.smartexec.infra.kafka.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private static final String PUBLISH_TOTAL = "infra.kafka.publish.total";

  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, String eventType, long durationNanos) {
    publishCounter(topic, eventType, "success", "none").increment();

    Timer.builder("infra.kafka.publish.duration")
        .description("Time from send to broker acknowledgement")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, String eventType, Throwable error) {
    String errorName = error == null ? "unknown" : error.getClass().getSimpleName();
    publishCounter(topic, eventType, "failure", errorName).increment();
  }

  private Counter publishCounter(String topic, String eventType, String outcome, String error) {
    return Counter.builder(PUBLISH_TOTAL)
        .description("Execution events published to Kafka by outcome")
        .tag("topic", safeValue(topic))
        .tag("event_type", safeValue(eventType))
        .tag("outcome", outcome)
        .tag("error", error)
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }
}
