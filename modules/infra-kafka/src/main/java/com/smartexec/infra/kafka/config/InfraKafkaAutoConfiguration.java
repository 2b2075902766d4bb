package com.smartexec.infra.kafka.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartexec.infra.kafka.observability.KafkaTelemetry;
import com.smartexec.infra.kafka.observability.MicrometerKafkaTelemetry;
import com.smartexec.infra.kafka.observability.NoOpKafkaTelemetry;
import com.smartexec.infra.kafka.producer.EventPublisher;
import com.smartexec.infra.kafka.producer.ExecutionEventProducer;
import com.smartexec.infra.kafka.producer.KafkaEventPublisher;
import com.smartexec.infra.kafka.producer.OrderEventProducer;
import com.smartexec.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.smartexec.infra.kafka.serde.EventObjectMapperFactory;
import com.smartexec.infra.kafka.topics.KafkaTopicDefinitions;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@AutoConfiguration
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "kafkaEventObjectMapper")
  public ObjectMapper kafkaEventObjectMapper() {
    return EventObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventEnvelopeJsonCodec eventEnvelopeJsonCodec(
      @Qualifier("kafkaEventObjectMapper") ObjectMapper kafkaEventObjectMapper) {
    return new EventEnvelopeJsonCodec(kafkaEventObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry micrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerKafkaTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(KafkaTelemetry.class)
  public KafkaTelemetry noOpKafkaTelemetry() {
    return new NoOpKafkaTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaProducerFactory")
  public ProducerFactory<String, String> infraKafkaProducerFactory(
      InfraKafkaProperties properties) {
    return new DefaultKafkaProducerFactory<>(properties.buildProducerConfig());
  }

  @Bean
  @ConditionalOnMissingBean(name = "infraKafkaTemplate")
  public KafkaTemplate<String, String> infraKafkaTemplate(
      ProducerFactory<String, String> infraKafkaProducerFactory) {
    return new KafkaTemplate<>(infraKafkaProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(
      KafkaTemplate<String, String> infraKafkaTemplate,
      EventEnvelopeJsonCodec eventEnvelopeJsonCodec,
      KafkaTelemetry kafkaTelemetry,
      InfraKafkaProperties properties) {
    return new KafkaEventPublisher(
        infraKafkaTemplate,
        eventEnvelopeJsonCodec,
        kafkaTelemetry,
        properties.getProducer().getSendTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderEventProducer orderEventProducer(
      EventPublisher eventPublisher, InfraKafkaProperties properties) {
    return new OrderEventProducer(eventPublisher, properties.getProducer().getClientId());
  }

  @Bean
  @ConditionalOnMissingBean
  public ExecutionEventProducer executionEventProducer(
      EventPublisher eventPublisher, InfraKafkaProperties properties) {
    return new ExecutionEventProducer(eventPublisher, properties.getProducer().getClientId());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka.topics",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "infraKafkaTopics")
  public KafkaAdmin.NewTopics infraKafkaTopics(InfraKafkaProperties properties) {
    InfraKafkaProperties.Topics topics = properties.getTopics();
    return new KafkaAdmin.NewTopics(
        KafkaTopicDefinitions.forAll(topics.getPartitions(), topics.getReplicationFactor())
            .stream()
            .map(KafkaTopicDefinitions.TopicDefinition::toNewTopic)
            .toArray(NewTopic[]::new));
  }
}
