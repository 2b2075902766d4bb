package com.smartexec.infra.kafka.producer;

import java.util.concurrent.TimeoutException;

/** An event the broker did not acknowledge, either rejected or not answered in time. */
public class KafkaPublishException extends RuntimeException {
  private final String topic;
  private final String key;
  private final String eventType;

  public KafkaPublishException(String topic, String key, String eventType, Throwable cause) {
    super(describe(topic, key, eventType, cause), cause);
    this.topic = topic;
    this.key = key;
    this.eventType = eventType;
  }

  public String getTopic() {
    return topic;
  }

  public String getKey() {
    return key;
  }

  public String getEventType() {
    return eventType;
  }

  public boolean isTimedOut() {
    return getCause() instanceof TimeoutException;
  }

  private static String describe(String topic, String key, String eventType, Throwable cause) {
    String outcome = cause instanceof TimeoutException ? "not acknowledged in time" : "rejected";
    return String.format("%s on %s was %s (key=%s)", eventType, topic, outcome, key);
  }
}
