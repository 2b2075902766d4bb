package com.smartexec.infra.kafka.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Versioned wrapper for every event leaving the execution core. The key is the order id, so all
 * events of one order land on the same partition in commit order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope<T>(
    UUID eventId,
    String eventType,
    int eventVersion,
    Instant occurredAt,
    String producer,
    String correlationId,
    String causationId,
    String key,
    T payload) {
  public EventEnvelope {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(occurredAt, "occurredAt");
    Objects.requireNonNull(payload, "payload");
    if (eventVersion <= 0) {
      throw new IllegalArgumentException("eventVersion must be positive, got " + eventVersion);
    }
    for (String text : new String[] {eventType, producer, correlationId, key}) {
      if (text == null || text.isBlank()) {
        throw new IllegalArgumentException(
            "eventType, producer, correlationId and key are required");
      }
    }
  }

  /** New envelope keyed and correlated by {@code key}, with a fresh event id. */
  public static <T> EventEnvelope<T> of(
      String eventType,
      int eventVersion,
      Instant occurredAt,
      String producer,
      String key,
      String causationId,
      T payload) {
    UUID eventId = UUID.randomUUID();
    return new EventEnvelope<>(
        eventId, eventType, eventVersion, occurredAt, producer, key, causationId, key, payload);
  }
}
