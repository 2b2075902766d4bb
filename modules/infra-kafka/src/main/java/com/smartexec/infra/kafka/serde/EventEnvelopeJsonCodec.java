package com.smartexec.infra.kafka.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartexec.infra.kafka.contract.EventEnvelope;
import java.util.Objects;

/** Envelope to JSON text and back, with the payload type supplied by the reader. */
public class EventEnvelopeJsonCodec {
  private final ObjectMapper mapper;

  public EventEnvelopeJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return mapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Cannot write " + envelope.eventType() + " envelope key=" + envelope.key(), ex);
    }
  }

  public <T> EventEnvelope<T> decode(String json, Class<T> payloadType) {
    JavaType type =
        mapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType);
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "Cannot read envelope of " + payloadType.getSimpleName() + ": " + ex.getOriginalMessage(),
          ex);
    }
  }
}
