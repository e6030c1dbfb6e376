package com.storagegateway.infra.database.connection;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.domain.storage.tenant.TenantConfigResolver;
import com.storagegateway.domain.storage.tenant.TenantDatabaseConfig;
import com.storagegateway.infra.database.config.DatabaseProperties;
import com.storagegateway.infra.database.pool.ConnectionPoolManager;
import com.storagegateway.infra.database.pool.TenantPool;
import com.storagegateway.infra.database.retry.RetryExecutor;
import java.util.Objects;

public class TenantConnectionFactory {
  private final ConnectionPoolManager poolManager;
  private final RetryExecutor acquireRetry;
  private final ObjectMapper objectMapper;
  private final TenantConfigResolver tenantConfigResolver;
  private final DatabaseProperties properties;

  public TenantConnectionFactory(
      ConnectionPoolManager poolManager,
      RetryExecutor acquireRetry,
      ObjectMapper objectMapper,
      TenantConfigResolver tenantConfigResolver,
      DatabaseProperties properties) {
    this.poolManager = Objects.requireNonNull(poolManager, "poolManager must not be null");
    this.acquireRetry = Objects.requireNonNull(acquireRetry, "acquireRetry must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.tenantConfigResolver = tenantConfigResolver;
    this.properties = Objects.requireNonNull(properties, "properties must not be null");
  }

  public TenantConnection getPostgresConnection(TenantConnectionOptions options) {
    TenantPool pool = poolManager.acquirePool(options);
    return new TenantConnection(pool, options, acquireRetry, objectMapper);
  }

  public TenantConnection forTenant(String tenantId, DatabaseUser user, DatabaseUser superUser) {
    return getPostgresConnection(optionsFor(tenantId, user, superUser));
  }

  public TenantConnection superUserConnection(String tenantId) {
    DatabaseUser serviceUser = DatabaseUser.serviceRole(properties.getServiceKey());
    return forTenant(tenantId, serviceUser, serviceUser);
  }

  TenantConnectionOptions optionsFor(String tenantId, DatabaseUser user, DatabaseUser superUser) {
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    TenantDatabaseConfig config = resolve(tenantId);
    return config
        .poolUrl()
        .map(
            poolUrl ->
                TenantConnectionOptions.of(tenantId, poolUrl, user, superUser)
                    .asExternalPool(config.maxConnections()))
        .orElseGet(() -> TenantConnectionOptions.of(tenantId, config.databaseUrl(), user, superUser));
  }

  private TenantDatabaseConfig resolve(String tenantId) {
    if (!properties.isMultitenant()) {
      if (properties.getDatabaseUrl() == null || properties.getDatabaseUrl().isBlank()) {
        throw new IllegalStateException("infra.database.database-url must be set");
      }
      return new TenantDatabaseConfig(
          properties.getDatabaseUrl(),
          properties.getDatabasePoolUrl(),
          properties.getDatabasePoolMaxConnections(),
          null);
    }
    if (tenantConfigResolver == null) {
      throw new IllegalStateException("Multi-tenant mode requires a TenantConfigResolver bean");
    }
    return tenantConfigResolver.resolve(tenantId);
  }
}
