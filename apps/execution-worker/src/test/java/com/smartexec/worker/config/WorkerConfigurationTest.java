package com.smartexec.worker.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.smartexec.domain.orders.Order;
import com.smartexec.domain.orders.OrderRequest;
import com.smartexec.domain.orders.OrderSide;
import com.smartexec.domain.orders.OrderStatus;
import com.smartexec.execution.config.ExecutionAutoConfiguration;
import com.smartexec.execution.dispatch.VenueExecutionEndpoint;
import com.smartexec.execution.service.OrderManagementService;
import com.smartexec.execution.service.OrderSubmission;
import com.smartexec.infra.kafka.config.InfraKafkaAutoConfiguration;
import com.smartexec.infra.kafka.producer.EventPublisher;
import com.smartexec.infra.kafka.topics.TopicNames;
import com.smartexec.worker.events.KafkaOrderEventBridge;
import com.smartexec.worker.expiry.OrderExpiryScheduler;
import com.smartexec.worker.simulation.SimulatedVenueExecutionEndpoint;
import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class WorkerConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(WorkerConfiguration.class)
          .withConfiguration(
              AutoConfigurations.of(
                  ExecutionAutoConfiguration.class, InfraKafkaAutoConfiguration.class))
          .withPropertyValues(
              "execution.routing.venues=NYSE,ARCA",
              "worker.simulation.venues[NYSE].books[AAPL].ask=150.00",
              "worker.simulation.venues[NYSE].books[AAPL].level-quantity=600",
              "worker.simulation.venues[NYSE].books[AAPL].levels=1",
              "worker.simulation.venues[ARCA].books[AAPL].ask=150.01",
              "worker.simulation.venues[ARCA].books[AAPL].level-quantity=800",
              "worker.simulation.venues[ARCA].books[AAPL].levels=1");

  @Test
  void shouldWireSimulatedVenuesIntoExecutionCore() {
    contextRunner.run(
        context -> {
          assertEquals(
              SimulatedVenueExecutionEndpoint.class,
              context.getBean(VenueExecutionEndpoint.class).getClass());
          assertTrue(context.containsBean("orderManagementService"));
          context.getBean(KafkaOrderEventBridge.class);
          context.getBean(OrderExpiryScheduler.class);
        });
  }

  @Test
  void shouldFillLimitOrderAcrossSimulatedVenuesAndPublishEvents() {
    EventPublisher eventPublisher = mock(EventPublisher.class);
    when(eventPublisher.publish(any(), any())).thenReturn(CompletableFuture.completedFuture(null));

    contextRunner
        .withBean(EventPublisher.class, () -> eventPublisher)
        .run(
            context -> {
              OrderManagementService service = context.getBean(OrderManagementService.class);

              OrderSubmission submission =
                  service.submit(
                      OrderRequest.limit(
                          "client-1", "AAPL", OrderSide.BUY, 1000L, new BigDecimal("150.05")));

              Order order = submission.order();
              assertEquals(OrderStatus.FILLED, order.status());
              assertEquals(1000L, submission.dispatch().totalFilled());
              assertEquals(0, new BigDecimal("150.004").compareTo(order.averagePrice()));
              verify(eventPublisher, times(2))
                  .publish(eq(TopicNames.EXECUTIONS_RECORDED_V1), any());
              verify(eventPublisher, atLeastOnce())
                  .publish(eq(TopicNames.ORDERS_UPDATED_V1), any());
            });
  }

  @Test
  void shouldLeaveVenuePortsToDeploymentWhenSimulationDisabled() {
    contextRunner
        .withPropertyValues("worker.simulation.enabled=false", "worker.events.kafka-enabled=false")
        .run(
            context -> {
              assertFalse(context.containsBean("simulatedVenueExecutionEndpoint"));
              assertFalse(context.containsBean("orderManagementService"));
              assertFalse(context.containsBean("kafkaOrderEventBridge"));
            });
  }
}
