package com.smartexec.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import com.smartexec.infra.kafka.contract.EventTypes;
import com.smartexec.infra.kafka.contract.payload.ExecutionRecordedV1;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class EventEnvelopeJsonCodecTest {
  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldDecodeWhatItEncodes() {
    ExecutionRecordedV1 payload =
        new ExecutionRecordedV1(
            "exec-1",
            "ord-1",
            null,
            "ACC-1",
            "AAPL",
            "BUY",
            "ARCA",
            400L,
            new BigDecimal("150.01"),
            1000L,
            new BigDecimal("150.00400000"),
            "FILLED",
            Instant.parse("2026-03-02T14:30:00Z"));
    EventEnvelope<ExecutionRecordedV1> source =
        EventEnvelope.of(
            EventTypes.EXECUTION_RECORDED,
            1,
            payload.executedAt(),
            "execution-worker",
            "ord-1",
            "exec-1",
            payload);

    String json = codec.encode(source);
    EventEnvelope<ExecutionRecordedV1> decoded = codec.decode(json, ExecutionRecordedV1.class);

    assertTrue(json.contains("\"occurredAt\":\"2026-03-02T14:30:00Z\""));
    assertFalse(json.contains("\"sliceId\""));
    assertEquals(source, decoded);
  }

  @Test
  void shouldIgnoreUnknownFieldsFromNewerProducers() {
    String json =
        "{\"eventId\":\"6c8a2f1e-1d7b-4f55-9a51-1b7d2a1c0e11\","
            + "\"eventType\":\"ExecutionRecorded\","
            + "\"eventVersion\":1,\"occurredAt\":\"2026-03-02T14:30:00Z\","
            + "\"producer\":\"execution-worker\",\"correlationId\":\"ord-9\",\"key\":\"ord-9\","
            + "\"region\":\"us-east\","
            + "\"payload\":{\"executionId\":\"exec-9\",\"orderId\":\"ord-9\","
            + "\"venue\":\"NYSE\",\"quantity\":100,\"price\":150.25,\"feeBps\":0.3}}";

    EventEnvelope<ExecutionRecordedV1> decoded = codec.decode(json, ExecutionRecordedV1.class);

    assertEquals("exec-9", decoded.payload().executionId());
    assertEquals(new BigDecimal("150.25"), decoded.payload().price());
  }

  @Test
  void shouldWrapMalformedJson() {
    assertThrows(
        IllegalStateException.class, () -> codec.decode("{not json", ExecutionRecordedV1.class));
  }
}
