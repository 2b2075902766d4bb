package com.smartexec.execution.config;

import com.smartexec.execution.algo.AlgorithmicScheduler;
import com.smartexec.execution.allocation.FillAllocator;
import com.smartexec.execution.compliance.ComplianceGate;
import com.smartexec.execution.compliance.RuleBasedComplianceGate;
import com.smartexec.execution.dispatch.ExecutionDispatcher;
import com.smartexec.execution.dispatch.VenueExecutionEndpoint;
import com.smartexec.execution.ledger.InMemoryOrderAuditRepository;
import com.smartexec.execution.ledger.InMemoryOrderStore;
import com.smartexec.execution.ledger.OrderAuditRepository;
import com.smartexec.execution.ledger.OrderLedger;
import com.smartexec.execution.ledger.OrderStore;
import com.smartexec.execution.lifecycle.OrderEventListener;
import com.smartexec.execution.lifecycle.OrderLifecycleService;
import com.smartexec.execution.marketdata.MarketActivitySource;
import com.smartexec.execution.marketdata.VenueQuoteSource;
import com.smartexec.execution.observability.ExecutionTelemetry;
import com.smartexec.execution.observability.MicrometerExecutionTelemetry;
import com.smartexec.execution.observability.NoOpExecutionTelemetry;
import com.smartexec.execution.reconciliation.FillReconciler;
import com.smartexec.execution.routing.RoutingConfig;
import com.smartexec.execution.routing.SmartOrderRouter;
import com.smartexec.execution.service.OrderManagementService;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the execution core. Venue connectivity ({@link VenueExecutionEndpoint}, {@link
 * VenueQuoteSource}, {@link MarketActivitySource}) comes from the application; without it only
 * the ledger and lifecycle beans are created.
 */
@AutoConfiguration
@EnableConfigurationProperties(ExecutionProperties.class)
public class ExecutionAutoConfiguration {

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(ExecutionTelemetry.class)
  public ExecutionTelemetry micrometerExecutionTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerExecutionTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(ExecutionTelemetry.class)
  public ExecutionTelemetry noOpExecutionTelemetry() {
    return new NoOpExecutionTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock executionClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderStore orderStore() {
    return new InMemoryOrderStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderAuditRepository orderAuditRepository() {
    return new InMemoryOrderAuditRepository();
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderLedger orderLedger(OrderStore orderStore) {
    return new OrderLedger(orderStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public OrderLifecycleService orderLifecycleService(
      OrderLedger orderLedger,
      OrderAuditRepository orderAuditRepository,
      ObjectProvider<OrderEventListener> listeners,
      ExecutionTelemetry executionTelemetry,
      ExecutionProperties properties,
      Clock clock) {
    return new OrderLifecycleService(
        orderLedger,
        orderAuditRepository,
        listeners.orderedStream().toList(),
        executionTelemetry,
        properties.toTradingSession(),
        clock,
        () -> UUID.randomUUID().toString());
  }

  @Bean
  @ConditionalOnMissingBean
  public ComplianceGate complianceGate(ExecutionProperties properties) {
    ExecutionProperties.Compliance compliance = properties.getCompliance();
    return new RuleBasedComplianceGate(
        compliance.getRestrictedSymbols(),
        compliance.getMaxOrderQuantity(),
        compliance.getMaxOrderNotional(),
        compliance.getLargeOrderWarningQuantity());
  }

  @Bean
  @ConditionalOnMissingBean
  public RoutingConfig defaultRoutingConfig(ExecutionProperties properties) {
    return properties.toRoutingConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public SmartOrderRouter smartOrderRouter() {
    return new SmartOrderRouter();
  }

  @Bean
  @ConditionalOnMissingBean
  public FillAllocator fillAllocator() {
    return new FillAllocator();
  }

  @Bean
  @ConditionalOnMissingBean
  public FillReconciler fillReconciler(OrderLifecycleService orderLifecycleService) {
    return new FillReconciler(orderLifecycleService);
  }

  @Bean(name = "venueExecutor")
  @ConditionalOnMissingBean(name = "venueExecutor")
  public ExecutorService venueExecutor(ExecutionProperties properties) {
    return Executors.newFixedThreadPool(
        Math.max(1, properties.getDispatch().getThreads()), namedThreads("venue-call-"));
  }

  @Bean(name = "algoTimer")
  @ConditionalOnMissingBean(name = "algoTimer")
  public ScheduledExecutorService algoTimer(ExecutionProperties properties) {
    return Executors.newScheduledThreadPool(
        Math.max(1, properties.getAlgo().getSchedulerThreads()), namedThreads("algo-tick-"));
  }

  @Bean
  @ConditionalOnBean({VenueExecutionEndpoint.class, VenueQuoteSource.class})
  @ConditionalOnMissingBean
  public ExecutionDispatcher executionDispatcher(
      VenueExecutionEndpoint venueExecutionEndpoint,
      VenueQuoteSource venueQuoteSource,
      SmartOrderRouter smartOrderRouter,
      OrderLifecycleService orderLifecycleService,
      @Qualifier("venueExecutor") ExecutorService venueExecutor,
      ExecutionTelemetry executionTelemetry,
      ExecutionProperties properties) {
    return new ExecutionDispatcher(
        venueExecutionEndpoint,
        venueQuoteSource,
        smartOrderRouter,
        orderLifecycleService,
        venueExecutor,
        properties.getDispatch().getVenueTimeout(),
        executionTelemetry);
  }

  @Bean
  @ConditionalOnBean({ExecutionDispatcher.class, MarketActivitySource.class})
  @ConditionalOnMissingBean
  public AlgorithmicScheduler algorithmicScheduler(
      OrderLifecycleService orderLifecycleService,
      ComplianceGate complianceGate,
      VenueQuoteSource venueQuoteSource,
      MarketActivitySource marketActivitySource,
      SmartOrderRouter smartOrderRouter,
      ExecutionDispatcher executionDispatcher,
      @Qualifier("algoTimer") ScheduledExecutorService algoTimer,
      RoutingConfig defaultRoutingConfig,
      ExecutionTelemetry executionTelemetry,
      ExecutionProperties properties,
      Clock clock) {
    ExecutionProperties.Algo algo = properties.getAlgo();
    return new AlgorithmicScheduler(
        orderLifecycleService,
        complianceGate,
        venueQuoteSource,
        marketActivitySource,
        smartOrderRouter,
        executionDispatcher,
        algoTimer,
        defaultRoutingConfig,
        algo.getTickInterval(),
        algo.getOnScheduleTolerance(),
        executionTelemetry,
        clock,
        algo.getRetainedFinishedOrders());
  }

  @Bean
  @ConditionalOnBean(AlgorithmicScheduler.class)
  @ConditionalOnMissingBean
  public OrderManagementService orderManagementService(
      OrderLifecycleService orderLifecycleService,
      ComplianceGate complianceGate,
      VenueQuoteSource venueQuoteSource,
      SmartOrderRouter smartOrderRouter,
      ExecutionDispatcher executionDispatcher,
      AlgorithmicScheduler algorithmicScheduler,
      RoutingConfig defaultRoutingConfig,
      ExecutionTelemetry executionTelemetry) {
    return new OrderManagementService(
        orderLifecycleService,
        complianceGate,
        venueQuoteSource,
        smartOrderRouter,
        executionDispatcher,
        algorithmicScheduler,
        defaultRoutingConfig,
        executionTelemetry);
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
