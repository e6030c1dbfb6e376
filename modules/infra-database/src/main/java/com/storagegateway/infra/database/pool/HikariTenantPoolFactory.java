package com.storagegateway.infra.database.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.concurrent.atomic.AtomicInteger;

public class HikariTenantPoolFactory implements TenantPoolFactory {
  private static final long IDLE_TIMEOUT_MS = 10_000L;
  private final AtomicInteger sequence = new AtomicInteger();

  @Override
  public TenantPool create(PoolSettings settings) {
    HikariConfig config = new HikariConfig();
    PostgresUrls.applyTo(config, settings.dbUrl());
    config.setPoolName("tenant-pool-" + sequence.incrementAndGet());
    config.setMaximumPoolSize(settings.maxConnections());
    config.setMinimumIdle(0);
    config.setIdleTimeout(IDLE_TIMEOUT_MS);
    config.setConnectionTimeout(Math.max(250L, settings.connectionTimeout().toMillis()));
    config.setAutoCommit(true);
    // external poolers get the search path per transaction instead
    if (!settings.external() && !settings.searchPath().isEmpty()) {
      config.addDataSourceProperty(
          "options", "-c search_path=" + String.join(",", settings.searchPath()));
    }
    return new HikariTenantPool(settings, new HikariDataSource(config));
  }
}
