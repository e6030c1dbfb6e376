package com.storagegateway.worker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.domain.storage.backend.StorageBackendAdapter;
import com.storagegateway.domain.storage.eventlog.HmacEventSignature;
import com.storagegateway.domain.storage.tenant.TenantConfigResolver;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.health.FatalErrorHandler;
import com.storagegateway.worker.eventlog.EventLogPublisherProperties;
import com.storagegateway.worker.events.BackupObjectHandler;
import com.storagegateway.worker.events.BackupProperties;
import com.storagegateway.worker.events.ObjectCreatedHandler;
import com.storagegateway.worker.events.WebhookHandler;
import com.storagegateway.worker.events.WebhookProperties;
import com.storagegateway.worker.tenant.JdbcTenantConfigResolver;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class WorkerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public HmacEventSignature eventSignature(
      EventLogPublisherProperties properties, ObjectMapper objectMapper) {
    String signingKey = properties.getSigningKey();
    if (signingKey == null || signingKey.isBlank()) {
      throw new IllegalStateException("storage.event-log.signing-key is required");
    }
    return new HmacEventSignature(signingKey, objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean(TenantConfigResolver.class)
  @ConditionalOnProperty(prefix = "infra.database", name = "multitenant", havingValue = "true")
  public JdbcTenantConfigResolver tenantConfigResolver(
      JdbcTemplate jdbcTemplate, WorkerProperties workerProperties) {
    return new JdbcTenantConfigResolver(
        jdbcTemplate, Duration.ofMillis(workerProperties.getTenantCacheTtlMs()));
  }

  @Bean
  public FatalErrorHandler processExitFatalErrorHandler(ConfigurableApplicationContext context) {
    return new ProcessExitFatalErrorHandler(context);
  }

  @Bean
  public WebhookHandler webhookHandler(WebhookProperties properties, ObjectMapper objectMapper) {
    return new WebhookHandler(properties, objectMapper);
  }

  @Bean
  public ObjectCreatedHandler objectCreatedHandler(JobQueue jobQueue, ObjectMapper objectMapper) {
    return new ObjectCreatedHandler(jobQueue, objectMapper);
  }

  @Bean
  @ConditionalOnBean(StorageBackendAdapter.class)
  public BackupObjectHandler backupObjectHandler(
      StorageBackendAdapter storageBackendAdapter, BackupProperties properties) {
    return new BackupObjectHandler(storageBackendAdapter, properties);
  }
}
