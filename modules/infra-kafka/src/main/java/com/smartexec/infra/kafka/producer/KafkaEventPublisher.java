package com.smartexec.infra.kafka.producer;

import com.smartexec.infra.kafka.contract.EventEnvelope;
import com.smartexec.infra.kafka.contract.EventHeaders;
import com.smartexec.infra.kafka.observability.KafkaTelemetry;
import com.smartexec.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.smartexec.infra.kafka.topics.TopicNameValidator;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * JSON-over-Kafka publisher. Send failures complete the returned future with a {@link
 * KafkaPublishException}; they are never thrown from {@link #publish}.
 */
public class KafkaEventPublisher implements EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final KafkaTelemetry telemetry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      KafkaTelemetry telemetry,
      Duration sendTimeout) {
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public <T> CompletableFuture<SendResult<String, String>> publish(
      String topic, EventEnvelope<T> envelope) {
    TopicNameValidator.requireValid(topic);
    Objects.requireNonNull(envelope, "envelope must not be null");

    ProducerRecord<String, String> record = toRecord(topic, envelope);
    long started = System.nanoTime();
    return applyTimeout(kafkaTemplate.send(record))
        .handle(
            (sendResult, throwable) -> {
              if (throwable == null) {
                telemetry.onPublishSuccess(
                    topic, envelope.eventType(), System.nanoTime() - started);
                return sendResult;
              }
              KafkaPublishException failure = wrap(topic, envelope, unwrap(throwable));
              telemetry.onPublishFailure(topic, envelope.eventType(), failure.getCause());
              log.warn(
                  "Kafka publish failed topic={} key={} eventType={} eventId={} reason={}",
                  topic,
                  envelope.key(),
                  envelope.eventType(),
                  envelope.eventId(),
                  failure.getMessage());
              throw failure;
            });
  }

  private ProducerRecord<String, String> toRecord(String topic, EventEnvelope<?> envelope) {
    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic, envelope.key(), codec.encode(envelope));
    Headers headers = record.headers();
    addHeader(headers, EventHeaders.X_EVENT_ID, envelope.eventId().toString());
    addHeader(headers, EventHeaders.X_EVENT_TYPE, envelope.eventType());
    addHeader(headers, EventHeaders.X_EVENT_VERSION, Integer.toString(envelope.eventVersion()));
    addHeader(headers, EventHeaders.X_CORRELATION_ID, envelope.correlationId());
    addHeader(headers, EventHeaders.X_PRODUCER, envelope.producer());
    addHeader(headers, EventHeaders.CONTENT_TYPE, EventHeaders.APPLICATION_JSON);
    return record;
  }

  private CompletableFuture<SendResult<String, String>> applyTimeout(
      CompletableFuture<SendResult<String, String>> sendFuture) {
    if (sendTimeout.isZero() || sendTimeout.isNegative()) {
      return sendFuture;
    }
    return sendFuture.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static KafkaPublishException wrap(
      String topic, EventEnvelope<?> envelope, Throwable cause) {
    if (cause instanceof KafkaPublishException existing) {
      return existing;
    }
    return new KafkaPublishException(topic, envelope.key(), envelope.eventType(), cause);
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  private static void addHeader(Headers headers, String name, String value) {
    headers.add(name, value.getBytes(StandardCharsets.UTF_8));
  }
}
