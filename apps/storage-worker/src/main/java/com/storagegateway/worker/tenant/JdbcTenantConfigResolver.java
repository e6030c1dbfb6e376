package com.storagegateway.worker.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.storagegateway.domain.storage.tenant.TenantConfigResolver;
import com.storagegateway.domain.storage.tenant.TenantDatabaseConfig;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;

/** Looks tenant database settings up in the control-plane {@code tenants} table. */
public class JdbcTenantConfigResolver implements TenantConfigResolver {
  private static final String SELECT_SQL =
      """
      SELECT database_url, database_pool_url, max_connections
      FROM tenants
      WHERE id = ?
      """;

  private final JdbcTemplate jdbcTemplate;
  private final Cache<String, TenantDatabaseConfig> cache;

  public JdbcTenantConfigResolver(JdbcTemplate jdbcTemplate, Duration cacheTtl) {
    this.jdbcTemplate = jdbcTemplate;
    this.cache = Caffeine.newBuilder().expireAfterWrite(cacheTtl).maximumSize(10_000).build();
  }

  @Override
  public TenantDatabaseConfig resolve(String tenantId) {
    return cache.get(tenantId, this::load);
  }

  public void invalidate(String tenantId) {
    cache.invalidate(tenantId);
  }

  private TenantDatabaseConfig load(String tenantId) {
    List<TenantDatabaseConfig> configs = jdbcTemplate.query(SELECT_SQL, this::mapConfig, tenantId);
    if (configs.isEmpty()) {
      throw new IllegalStateException("Missing tenant config for tenant " + tenantId);
    }
    return configs.get(0);
  }

  private TenantDatabaseConfig mapConfig(ResultSet rs, int rowNum) throws SQLException {
    String poolUrl = rs.getString("database_pool_url");
    int maxConnections = rs.getInt("max_connections");
    return new TenantDatabaseConfig(
        rs.getString("database_url"),
        poolUrl,
        rs.wasNull() ? null : maxConnections,
        poolUrl == null ? TenantDatabaseConfig.PoolMode.INTERNAL : TenantDatabaseConfig.PoolMode.EXTERNAL);
  }
}
