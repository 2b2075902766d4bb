package com.smartexec.worker.config;

import com.smartexec.execution.dispatch.VenueExecutionEndpoint;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import com.smartexec.execution.marketdata.MarketActivitySource;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import com.smartexec.infra.kafka.producer.ExecutionEventProducer;
import com.smartexec.infra.kafka.producer.OrderEventProducer;
import com.smartexec.worker.events.KafkaOrderEventBridge;
import com.smartexec.worker.expiry.OrderExpiryScheduler;
import com.smartexec.worker.simulation.ConfiguredVenueQuoteSource;
import com.smartexec.worker.simulation.SimulatedMarketActivitySource;
import com.smartexec.worker.simulation.SimulatedVenueExecutionEndpoint;
import com.smartexec.worker.simulation.SimulationProperties;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Venue ports for the worker. The simulated ports are the default; a deployment replaces them by
 * declaring its own {@link VenueExecutionEndpoint}, {@link VenueQuoteSource} and {@link
 * MarketActivitySource} beans or by setting {@code worker.simulation.enabled=false}.
 */
@Configuration
@EnableConfigurationProperties(SimulationProperties.class)
public class WorkerConfiguration {
  @Bean
  @ConditionalOnProperty(
      prefix = "worker.simulation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(VenueExecutionEndpoint.class)
  VenueExecutionEndpoint simulatedVenueExecutionEndpoint(
      SimulationProperties properties, Clock executionClock) {
    return new SimulatedVenueExecutionEndpoint(properties, executionClock);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "worker.simulation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(VenueQuoteSource.class)
  VenueQuoteSource configuredVenueQuoteSource(SimulationProperties properties) {
    return new ConfiguredVenueQuoteSource(properties);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "worker.simulation",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(MarketActivitySource.class)
  MarketActivitySource simulatedMarketActivitySource(
      SimulationProperties properties, Clock executionClock) {
    return new SimulatedMarketActivitySource(properties, executionClock);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "worker.events",
      name = "kafka-enabled",
      havingValue = "true",
      matchIfMissing = true)
  KafkaOrderEventBridge kafkaOrderEventBridge(
      OrderEventProducer orderEventProducer, ExecutionEventProducer executionEventProducer) {
    return new KafkaOrderEventBridge(orderEventProducer, executionEventProducer);
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "worker.expiry",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  OrderExpiryScheduler orderExpiryScheduler(
      OrderLifecycleService orderLifecycleService, Clock executionClock) {
    return new OrderExpiryScheduler(orderLifecycleService, executionClock);
  }
}
