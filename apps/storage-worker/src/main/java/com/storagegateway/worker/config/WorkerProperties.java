package com.storagegateway.worker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "storage.worker")
public class WorkerProperties {
  private long shutdownTimeoutMs = 30_000L;
  private boolean queueWorkersEnabled = true;
  private boolean tenantMigrationsEnabled = true;
  private long tenantCacheTtlMs = 60_000L;

  public long getShutdownTimeoutMs() {
    return shutdownTimeoutMs;
  }

  public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
    this.shutdownTimeoutMs = shutdownTimeoutMs;
  }

  public boolean isQueueWorkersEnabled() {
    return queueWorkersEnabled;
  }

  public void setQueueWorkersEnabled(boolean queueWorkersEnabled) {
    this.queueWorkersEnabled = queueWorkersEnabled;
  }

  public boolean isTenantMigrationsEnabled() {
    return tenantMigrationsEnabled;
  }

  public void setTenantMigrationsEnabled(boolean tenantMigrationsEnabled) {
    this.tenantMigrationsEnabled = tenantMigrationsEnabled;
  }

  public long getTenantCacheTtlMs() {
    return tenantCacheTtlMs;
  }

  public void setTenantCacheTtlMs(long tenantCacheTtlMs) {
    this.tenantCacheTtlMs = tenantCacheTtlMs;
  }
}
