package com.storagegateway.infra.queue.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.storagegateway.infra.queue.engine.HandlerRegistry;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.engine.QueueMaintenanceTask;
import com.storagegateway.infra.queue.health.QueueHealthMonitor;
import com.storagegateway.infra.queue.lifecycle.ShutdownCoordinator;
import com.storagegateway.infra.queue.observability.MicrometerQueueTelemetry;
import com.storagegateway.infra.queue.observability.NoOpQueueTelemetry;
import com.storagegateway.infra.queue.observability.QueueTelemetry;
import com.storagegateway.infra.queue.store.JdbcQueueStore;
import com.storagegateway.infra.queue.store.QueueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class InfraQueueAutoConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(InfraQueueAutoConfiguration.class);

  @Test
  void shouldWireQueueBeansForSingleTenantDatabase() {
    contextRunner
        .withPropertyValues("infra.queue.database-url=jdbc:postgresql://localhost:5432/storage")
        .run(
            context -> {
              assertNotNull(context.getBean(JobQueue.class));
              assertNotNull(context.getBean(HandlerRegistry.class));
              assertNotNull(context.getBean(QueueHealthMonitor.class));
              assertNotNull(context.getBean(ShutdownCoordinator.class));
              assertNotNull(context.getBean(QueueMaintenanceTask.class));
              assertInstanceOf(JdbcQueueStore.class, context.getBean(QueueStore.class));
              assertEquals(NoOpQueueTelemetry.class, context.getBean(QueueTelemetry.class).getClass());
            });
  }

  @Test
  void shouldUseMicrometerTelemetryWhenMeterRegistryIsPresent() {
    contextRunner
        .withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
        .withPropertyValues("infra.queue.database-url=jdbc:postgresql://localhost:5432/storage")
        .run(
            context ->
                assertEquals(
                    MicrometerQueueTelemetry.class, context.getBean(QueueTelemetry.class).getClass()));
  }

  @Test
  void shouldFailStartupWhenMultitenantQueueUrlIsMissing() {
    contextRunner
        .withPropertyValues("infra.queue.multitenant=true")
        .run(
            context -> {
              Throwable failure = context.getStartupFailure();
              assertNotNull(failure);
              Throwable root = failure;
              while (root.getCause() != null) {
                root = root.getCause();
              }
              assertInstanceOf(IllegalStateException.class, root);
              assertTrue(root.getMessage().contains("multitenant-database-url"));
            });
  }

  @Test
  void shouldSkipMaintenanceWhenDisabled() {
    contextRunner
        .withPropertyValues(
            "infra.queue.database-url=jdbc:postgresql://localhost:5432/storage",
            "infra.queue.maintenance.enabled=false")
        .run(context -> assertFalse(context.containsBean("queueMaintenanceTask")));
  }

  @Test
  void shouldBackOffWhenQueueDisabled() {
    contextRunner
        .withPropertyValues("infra.queue.enabled=false")
        .run(context -> assertTrue(context.getBeansOfType(JobQueue.class).isEmpty()));
  }
}
