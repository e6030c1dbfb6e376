package com.storagegateway.infra.database.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.domain.storage.tenant.TenantConfigResolver;
import com.storagegateway.infra.database.connection.TenantConnectionFactory;
import com.storagegateway.infra.database.errors.DatabaseErrors;
import com.storagegateway.infra.database.pool.ConnectionPoolManager;
import com.storagegateway.infra.database.pool.HikariTenantPoolFactory;
import com.storagegateway.infra.database.pool.PoolDefaults;
import com.storagegateway.infra.database.pool.TenantPoolFactory;
import com.storagegateway.infra.database.retry.RetryExecutor;
import com.storagegateway.infra.database.retry.RetryPolicy;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(DatabaseProperties.class)
public class InfraDatabaseAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public TenantPoolFactory tenantPoolFactory() {
    return new HikariTenantPoolFactory();
  }

  @Bean(destroyMethod = "stop")
  @ConditionalOnMissingBean
  public ConnectionPoolManager connectionPoolManager(
      TenantPoolFactory tenantPoolFactory,
      DatabaseProperties properties,
      ObjectProvider<MeterRegistry> meterRegistry) {
    PoolDefaults defaults =
        new PoolDefaults(
            properties.effectiveMaxConnections(),
            Duration.ofMillis(properties.getConnectionTimeoutMs()),
            PoolDefaults.searchPathWith(properties.getSearchPath()));
    ConnectionPoolManager manager =
        new ConnectionPoolManager(
            tenantPoolFactory, defaults, Duration.ofMillis(properties.effectivePoolIdleTtlMs()));
    meterRegistry.ifAvailable(
        registry ->
            Gauge.builder("db.pool.active", manager, ConnectionPoolManager::activePoolCount)
                .description("Live tenant connection pools")
                .register(registry));
    return manager;
  }

  @Bean
  @ConditionalOnMissingBean(name = "tenantTransactionRetryExecutor")
  public RetryExecutor tenantTransactionRetryExecutor(
      DatabaseProperties properties, ObjectProvider<MeterRegistry> meterRegistry) {
    DatabaseProperties.TransactionRetry retry = properties.getTransactionRetry();
    RetryPolicy policy =
        new RetryPolicy(
            Duration.ofMillis(retry.getMinDelayMs()),
            Duration.ofMillis(Math.max(retry.getMinDelayMs(), retry.getMaxDelayMs())),
            Duration.ofMillis(retry.getMaxElapsedMs()),
            retry.getMaxRetries(),
            DatabaseErrors::isConnectionLimitError);
    return new RetryExecutor(
        "tenant_transaction", policy, meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public TenantConnectionFactory tenantConnectionFactory(
      ConnectionPoolManager connectionPoolManager,
      @Qualifier("tenantTransactionRetryExecutor") RetryExecutor tenantTransactionRetryExecutor,
      ObjectProvider<ObjectMapper> objectMapper,
      ObjectProvider<TenantConfigResolver> tenantConfigResolver,
      DatabaseProperties properties) {
    return new TenantConnectionFactory(
        connectionPoolManager,
        tenantTransactionRetryExecutor,
        objectMapper.getIfAvailable(ObjectMapper::new),
        tenantConfigResolver.getIfAvailable(),
        properties);
  }
}
