package com.storagegateway.infra.queue.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.infra.database.pool.PostgresUrls;
import com.storagegateway.infra.queue.engine.HandlerRegistry;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.engine.LoggingQueueErrorListener;
import com.storagegateway.infra.queue.engine.QueueMaintenanceTask;
import com.storagegateway.infra.queue.health.FatalErrorHandler;
import com.storagegateway.infra.queue.health.HealthTrackingStoreObserver;
import com.storagegateway.infra.queue.health.QueueHealthConfig;
import com.storagegateway.infra.queue.health.QueueHealthMonitor;
import com.storagegateway.infra.queue.lifecycle.ShutdownCoordinator;
import com.storagegateway.infra.queue.observability.MicrometerQueueTelemetry;
import com.storagegateway.infra.queue.observability.NoOpQueueTelemetry;
import com.storagegateway.infra.queue.observability.QueueTelemetry;
import com.storagegateway.infra.queue.store.JdbcQueueStore;
import com.storagegateway.infra.queue.store.QueueStore;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(QueueProperties.class)
@ConditionalOnProperty(prefix = "infra.queue", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InfraQueueAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(InfraQueueAutoConfiguration.class);

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(QueueTelemetry.class)
  public QueueTelemetry micrometerQueueTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerQueueTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(QueueTelemetry.class)
  public QueueTelemetry noOpQueueTelemetry() {
    return new NoOpQueueTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public FatalErrorHandler fatalErrorHandler() {
    return error -> log.error("Fatal queue error, no fatal handler configured error={}", error.getMessage(), error);
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueHealthMonitor queueHealthMonitor(
      QueueProperties properties,
      ObjectProvider<JobQueue> jobQueue,
      FatalErrorHandler fatalErrorHandler) {
    QueueProperties.Health health = properties.getHealth();
    QueueHealthConfig config =
        new QueueHealthConfig(
            health.getMaxConsecutiveErrors(),
            Duration.ofMillis(health.getUnhealthyTimeoutMs()),
            Duration.ofMillis(health.getShutdownTimeoutMs()));
    // resolved lazily, the queue depends on the store which reports into this monitor
    return new QueueHealthMonitor(config, () -> jobQueue.getObject().stop(), fatalErrorHandler);
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(QueueStore.class)
  public QueueStore queueStore(
      QueueProperties properties, ObjectProvider<ObjectMapper> objectMapper, QueueHealthMonitor healthMonitor) {
    HikariDataSource dataSource = queueDataSource(properties);
    return new JdbcQueueStore(
        dataSource,
        objectMapper.getIfAvailable(ObjectMapper::new),
        new HealthTrackingStoreObserver(healthMonitor));
  }

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry handlerRegistry() {
    return new HandlerRegistry();
  }

  // the store is closed by JobQueue.stop, not by the container
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public JobQueue jobQueue(
      QueueStore queueStore,
      HandlerRegistry handlerRegistry,
      QueueTelemetry queueTelemetry,
      QueueProperties properties) {
    // connection health comes from the store observer only
    return new JobQueue(
        queueStore,
        handlerRegistry,
        queueTelemetry,
        new LoggingQueueErrorListener(),
        Duration.ofMillis(properties.getShutdownGracePeriodMs()),
        Duration.ofMillis(properties.getStopTimeoutMs()));
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "infra.queue.maintenance", name = "enabled", havingValue = "true", matchIfMissing = true)
  public QueueMaintenanceTask queueMaintenanceTask(JobQueue jobQueue) {
    return new QueueMaintenanceTask(jobQueue);
  }

  @Bean
  @ConditionalOnMissingBean
  public ShutdownCoordinator shutdownCoordinator() {
    return new ShutdownCoordinator();
  }

  static HikariDataSource queueDataSource(QueueProperties properties) {
    String url = properties.resolveConnectionUrl();
    // not started until the first connection is requested
    HikariDataSource dataSource = new HikariDataSource();
    PostgresUrls.applyTo(dataSource, url);
    dataSource.setPoolName("storage-queue");
    dataSource.setMaximumPoolSize(Math.max(1, properties.getMaxConnections()));
    dataSource.setMinimumIdle(0);
    dataSource.setConnectionTimeout(Math.max(250L, properties.getConnectionTimeoutMs()));
    if (properties.getStatementTimeoutMs() > 0) {
      dataSource.addDataSourceProperty(
          "options", "-c statement_timeout=" + properties.getStatementTimeoutMs());
    }
    return dataSource;
  }
}
