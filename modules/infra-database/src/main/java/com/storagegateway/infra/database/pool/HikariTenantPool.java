package com.storagegateway.infra.database.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.sql.DataSource;

public class HikariTenantPool implements TenantPool {
  private final PoolSettings settings;
  private final HikariDataSource dataSource;
  private final AtomicBoolean destroyed = new AtomicBoolean(false);

  public HikariTenantPool(PoolSettings settings, HikariDataSource dataSource) {
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
  }

  @Override
  public String dbUrl() {
    return settings.dbUrl();
  }

  @Override
  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public boolean isExternal() {
    return settings.external();
  }

  @Override
  public List<String> searchPath() {
    return settings.searchPath();
  }

  @Override
  public void destroy() {
    if (destroyed.compareAndSet(false, true)) {
      dataSource.close();
    }
  }

  @Override
  public boolean isDestroyed() {
    return destroyed.get();
  }

  @Override
  public int inUseConnections() {
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    if (pool == null || dataSource.isClosed()) {
      return 0;
    }
    return pool.getActiveConnections() + pool.getThreadsAwaitingConnection();
  }
}
