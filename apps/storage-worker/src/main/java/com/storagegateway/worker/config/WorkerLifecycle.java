package com.storagegateway.worker.config;

import com.storagegateway.infra.database.connection.TenantConnectionFactory;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.engine.QueueEventHandler;
import com.storagegateway.infra.queue.engine.QueueStartOptions;
import com.storagegateway.infra.queue.lifecycle.ShutdownCoordinator;
import com.storagegateway.worker.eventlog.EventLogPublisherProperties;
import com.storagegateway.worker.eventlog.EventPublisher;
import com.storagegateway.worker.eventlog.TenantSchemaMigrator;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Brings the worker up once the context is ready: tenant migrations (single-tenant only), handler
 * registration, queue start, then the event log publisher. Shutdown runs the other way round
 * through the {@link ShutdownCoordinator}.
 */
@Component
public class WorkerLifecycle {
  private static final Logger log = LoggerFactory.getLogger(WorkerLifecycle.class);

  private final JobQueue jobQueue;
  private final List<QueueEventHandler> handlers;
  private final ShutdownCoordinator shutdownCoordinator;
  private final ObjectProvider<EventPublisher> eventPublisher;
  private final TenantConnectionFactory connectionFactory;
  private final EventLogPublisherProperties eventLogProperties;
  private final WorkerProperties properties;

  public WorkerLifecycle(
      JobQueue jobQueue,
      List<QueueEventHandler> handlers,
      ShutdownCoordinator shutdownCoordinator,
      ObjectProvider<EventPublisher> eventPublisher,
      TenantConnectionFactory connectionFactory,
      EventLogPublisherProperties eventLogProperties,
      WorkerProperties properties) {
    this.jobQueue = jobQueue;
    this.handlers = handlers;
    this.shutdownCoordinator = shutdownCoordinator;
    this.eventPublisher = eventPublisher;
    this.connectionFactory = connectionFactory;
    this.eventLogProperties = eventLogProperties;
    this.properties = properties;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    migrateTenantSchema();

    handlers.forEach(jobQueue::register);
    QueueStartOptions options =
        properties.isQueueWorkersEnabled()
            ? QueueStartOptions.withWorkers(
                shutdownCoordinator.signal(),
                job -> log.debug("Queue job received queue={} job_id={}", job.name(), job.id()))
            : QueueStartOptions.producerOnly(shutdownCoordinator.signal());
    jobQueue.start(options);
    shutdownCoordinator.register("queue", jobQueue::stop);
    log.info(
        "Queue started handlers={} workers_enabled={}",
        handlers.stream().map(QueueEventHandler::queueName).toList(),
        properties.isQueueWorkersEnabled());

    eventPublisher.ifAvailable(
        publisher -> {
          shutdownCoordinator.register("event-publisher", publisher::stop);
          publisher.start(shutdownCoordinator.signal());
        });
  }

  @PreDestroy
  public void stop() {
    log.info("Worker shutting down timeout_ms={}", properties.getShutdownTimeoutMs());
    shutdownCoordinator.shutdown(Duration.ofMillis(properties.getShutdownTimeoutMs()));
  }

  private void migrateTenantSchema() {
    String tenantId = eventLogProperties.getTenantId();
    if (!properties.isTenantMigrationsEnabled()
        || eventLogProperties.isMultitenant()
        || tenantId == null
        || tenantId.isBlank()) {
      return;
    }
    TenantSchemaMigrator.migrate(connectionFactory.superUserConnection(tenantId).pool().dataSource());
    log.info("Tenant event log schema migrated tenant_id={}", tenantId);
  }
}
