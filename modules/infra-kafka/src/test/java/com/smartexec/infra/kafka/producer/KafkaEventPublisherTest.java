package com.smartexec.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import com.smartexec.infra.kafka.contract.EventHeaders;
import com.smartexec.infra.kafka.contract.EventTypes;
import com.smartexec.infra.kafka.contract.payload.OrderUpdatedV1;
import com.smartexec.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.smartexec.infra.kafka.observability.NoOpKafkaTelemetry;
import com.smartexec.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.smartexec.infra.kafka.serde.EventObjectMapperFactory;
import com.smartexec.infra.kafka.topics.TopicNames;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

class KafkaEventPublisherTest {
  private static final Instant UPDATED_AT = Instant.parse("2026-03-02T14:30:00Z");

  private final EventEnvelopeJsonCodec codec =
      new EventEnvelopeJsonCodec(EventObjectMapperFactory.create());

  @Test
  void shouldPublishKeyedRecordWithHeaders() throws Exception {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);
    ProducerRecord<String, String> sent =
        new ProducerRecord<>(TopicNames.ORDERS_UPDATED_V1, "ord-1", "{}");
    when(kafkaTemplate.send(any(ProducerRecord.class)))
        .thenReturn(CompletableFuture.completedFuture(new SendResult<>(sent, null)));

    EventEnvelope<OrderUpdatedV1> envelope = envelope("ord-1");
    publisher.publish(TopicNames.ORDERS_UPDATED_V1, envelope).get();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<ProducerRecord<String, String>> captor =
        ArgumentCaptor.forClass(ProducerRecord.class);
    verify(kafkaTemplate).send(captor.capture());
    ProducerRecord<String, String> record = captor.getValue();

    assertEquals(TopicNames.ORDERS_UPDATED_V1, record.topic());
    assertEquals("ord-1", record.key());
    assertNotNull(record.value());
    assertEquals(envelope.eventId().toString(), headerValue(record, EventHeaders.X_EVENT_ID));
    assertEquals(EventTypes.ORDER_UPDATED, headerValue(record, EventHeaders.X_EVENT_TYPE));
    assertEquals("1", headerValue(record, EventHeaders.X_EVENT_VERSION));
    assertEquals("ord-1", headerValue(record, EventHeaders.X_CORRELATION_ID));
    assertEquals("execution-worker", headerValue(record, EventHeaders.X_PRODUCER));
    assertEquals(EventHeaders.APPLICATION_JSON, headerValue(record, EventHeaders.CONTENT_TYPE));
  }

  @Test
  void shouldCompleteExceptionallyWithKafkaPublishExceptionAndCountFailure() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(
            kafkaTemplate, codec, new MicrometerKafkaTelemetry(registry), Duration.ZERO);
    CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
    failed.completeExceptionally(new IllegalStateException("broker unavailable"));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(failed);

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(TopicNames.ORDERS_UPDATED_V1, envelope("ord-2")).get());

    KafkaPublishException cause = assertInstanceOf(KafkaPublishException.class, ex.getCause());
    assertEquals("ord-2", cause.getKey());
    assertEquals(TopicNames.ORDERS_UPDATED_V1, cause.getTopic());
    assertInstanceOf(IllegalStateException.class, cause.getCause());
    assertFalse(cause.isTimedOut());
    assertEquals(
        1.0,
        registry
            .get("infra.kafka.publish.total")
            .tag("outcome", "failure")
            .tag("error", "IllegalStateException")
            .counter()
            .count());
  }

  @Test
  void shouldTimeOutWhenBrokerNeverAcknowledges() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(
            kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ofMillis(50));
    when(kafkaTemplate.send(any(ProducerRecord.class))).thenReturn(new CompletableFuture<>());

    ExecutionException ex =
        assertThrows(
            ExecutionException.class,
            () -> publisher.publish(TopicNames.ORDERS_UPDATED_V1, envelope("ord-3")).get());

    KafkaPublishException cause = assertInstanceOf(KafkaPublishException.class, ex.getCause());
    assertInstanceOf(TimeoutException.class, cause.getCause());
    assertTrue(cause.isTimedOut());
    assertEquals(EventTypes.ORDER_UPDATED, cause.getEventType());
  }

  @Test
  void shouldRejectInvalidTopicBeforeSending() {
    @SuppressWarnings("unchecked")
    KafkaTemplate<String, String> kafkaTemplate = mock(KafkaTemplate.class);
    KafkaEventPublisher publisher =
        new KafkaEventPublisher(kafkaTemplate, codec, new NoOpKafkaTelemetry(), Duration.ZERO);

    assertThrows(
        IllegalArgumentException.class,
        () -> publisher.publish("Orders_Updated", envelope("ord-4")));
    verify(kafkaTemplate, never()).send(any(ProducerRecord.class));
  }

  private static EventEnvelope<OrderUpdatedV1> envelope(String orderId) {
    OrderUpdatedV1 payload =
        new OrderUpdatedV1(
            orderId,
            "cl-" + orderId,
            null,
            "ACC-1",
            "AAPL",
            "BUY",
            "LIMIT",
            "NEW",
            "PARTIALLY_FILLED",
            "execution",
            1000L,
            400L,
            600L,
            new BigDecimal("150.05"),
            new BigDecimal("150.00000000"),
            null,
            UPDATED_AT);
    return EventEnvelope.of(
        EventTypes.ORDER_UPDATED, 1, UPDATED_AT, "execution-worker", orderId, null, payload);
  }

  private static String headerValue(ProducerRecord<String, String> record, String headerName) {
    Header header = record.headers().lastHeader(headerName);
    assertNotNull(header, "Expected header " + headerName + " to exist");
    return new String(header.value(), StandardCharsets.UTF_8);
  }
}
