package com.storagegateway.infra.database.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.domain.storage.tenant.TenantConfigResolver;
import com.storagegateway.domain.storage.tenant.TenantDatabaseConfig;
import com.storagegateway.infra.database.config.DatabaseProperties;
import com.storagegateway.infra.database.pool.ConnectionPoolManager;
import com.storagegateway.infra.database.retry.RetryExecutor;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TenantConnectionFactoryTest {
  private static final DatabaseUser USER = new DatabaseUser("jwt", Map.of("role", "authenticated"));

  @Test
  void shouldUseConfiguredUrlInSingleTenantMode() {
    DatabaseProperties properties = new DatabaseProperties();
    properties.setDatabaseUrl("postgres://localhost:5432/postgres");

    TenantConnectionOptions options = factory(properties, null).optionsFor("storage-single-tenant", USER, USER);

    assertEquals("postgres://localhost:5432/postgres", options.dbUrl());
    assertFalse(options.externalPool());
  }

  @Test
  void shouldPreferPoolerUrlResolvedForTenant() {
    DatabaseProperties properties = new DatabaseProperties();
    properties.setMultitenant(true);
    TenantConnectionFactory factory =
        factory(
            properties,
            tenantId ->
                new TenantDatabaseConfig(
                    "postgres://" + tenantId + ".db:5432/postgres",
                    "postgres://" + tenantId + ".pooler:6543/postgres",
                    6,
                    TenantDatabaseConfig.PoolMode.EXTERNAL));

    TenantConnectionOptions options = factory.optionsFor("tenant-a", USER, USER);

    assertEquals("postgres://tenant-a.pooler:6543/postgres", options.dbUrl());
    assertTrue(options.externalPool());
    assertEquals(6, options.maxConnections());
  }

  @Test
  void shouldUseDirectUrlWhenTenantHasNoPooler() {
    DatabaseProperties properties = new DatabaseProperties();
    properties.setMultitenant(true);
    TenantConnectionFactory factory =
        factory(properties, tenantId -> new TenantDatabaseConfig("postgres://direct/postgres", " ", null, null));

    TenantConnectionOptions options = factory.optionsFor("tenant-b", USER, USER);

    assertEquals("postgres://direct/postgres", options.dbUrl());
    assertFalse(options.externalPool());
  }

  @Test
  void shouldFailWithoutResolverInMultitenantMode() {
    DatabaseProperties properties = new DatabaseProperties();
    properties.setMultitenant(true);

    assertThrows(IllegalStateException.class, () -> factory(properties, null).optionsFor("tenant-a", USER, USER));
  }

  private static TenantConnectionFactory factory(
      DatabaseProperties properties,
      TenantConfigResolver resolver) {
    return new TenantConnectionFactory(
        mock(ConnectionPoolManager.class), mock(RetryExecutor.class), new ObjectMapper(), resolver, properties);
  }
}
