package com.storagegateway.worker.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.domain.storage.eventlog.HmacEventSignature;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.health.FatalErrorHandler;
import com.storagegateway.worker.eventlog.EventLogPublisherProperties;
import com.storagegateway.worker.events.BackupObjectHandler;
import com.storagegateway.worker.events.BackupProperties;
import com.storagegateway.worker.events.ObjectCreatedHandler;
import com.storagegateway.worker.events.WebhookHandler;
import com.storagegateway.worker.events.WebhookProperties;
import com.storagegateway.worker.tenant.JdbcTenantConfigResolver;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

class WorkerConfigurationTest {
  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(
              PropertiesConfiguration.class,
              EventLogPublisherProperties.class,
              WorkerProperties.class,
              WebhookProperties.class,
              BackupProperties.class,
              WorkerConfiguration.class)
          .withBean(ObjectMapper.class, ObjectMapper::new)
          .withBean(JobQueue.class, () -> mock(JobQueue.class))
          .withBean(JdbcTemplate.class, () -> mock(JdbcTemplate.class))
          .withPropertyValues("storage.event-log.signing-key=test-signing-key");

  @Test
  void shouldRegisterSingleTenantWorkerBeans() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(HmacEventSignature.class);
          assertThat(context).hasSingleBean(WebhookHandler.class);
          assertThat(context).hasSingleBean(ObjectCreatedHandler.class);
          assertThat(context).doesNotHaveBean(BackupObjectHandler.class);
          assertThat(context).doesNotHaveBean(JdbcTenantConfigResolver.class);
          assertThat(context.getBean(FatalErrorHandler.class)).isInstanceOf(ProcessExitFatalErrorHandler.class);
        });
  }

  @Test
  void shouldResolveTenantsFromControlPlaneInMultitenantMode() {
    contextRunner
        .withPropertyValues("infra.database.multitenant=true")
        .run(context -> assertThat(context).hasSingleBean(JdbcTenantConfigResolver.class));
  }

  @Test
  void shouldFailWithoutSigningKey() {
    contextRunner
        .withPropertyValues("storage.event-log.signing-key=")
        .run(
            context ->
                assertThat(context)
                    .getFailure()
                    .rootCause()
                    .hasMessageContaining("storage.event-log.signing-key"));
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties
  static class PropertiesConfiguration {}
}
