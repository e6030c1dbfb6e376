package com.storagegateway.infra.queue.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.queue")
public class QueueProperties {
  private boolean enabled = true;
  private boolean multitenant;
  private String connectionUrl;
  private String databaseUrl;
  private String multitenantDatabaseUrl;
  private int maxConnections = 4;
  private long connectionTimeoutMs = 3000;
  private long statementTimeoutMs;
  private long shutdownGracePeriodMs = 15000;
  private long stopTimeoutMs = 20000;
  private long maintenanceIntervalMs = 60000;
  private final Health health = new Health();

  /**
   * Picks the dedicated queue URL when set, otherwise the database the rest of the service uses.
   * In multi-tenant mode there is no shared database, so a missing URL is a configuration error.
   */
  public String resolveConnectionUrl() {
    if (hasText(connectionUrl)) {
      return connectionUrl;
    }
    if (multitenant) {
      if (!hasText(multitenantDatabaseUrl)) {
        throw new IllegalStateException(
            "infra.queue.multitenant-database-url is not set while running in multi-tenant mode");
      }
      return multitenantDatabaseUrl;
    }
    if (!hasText(databaseUrl)) {
      throw new IllegalStateException("infra.queue.database-url is not set");
    }
    return databaseUrl;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isMultitenant() {
    return multitenant;
  }

  public void setMultitenant(boolean multitenant) {
    this.multitenant = multitenant;
  }

  public String getConnectionUrl() {
    return connectionUrl;
  }

  public void setConnectionUrl(String connectionUrl) {
    this.connectionUrl = connectionUrl;
  }

  public String getDatabaseUrl() {
    return databaseUrl;
  }

  public void setDatabaseUrl(String databaseUrl) {
    this.databaseUrl = databaseUrl;
  }

  public String getMultitenantDatabaseUrl() {
    return multitenantDatabaseUrl;
  }

  public void setMultitenantDatabaseUrl(String multitenantDatabaseUrl) {
    this.multitenantDatabaseUrl = multitenantDatabaseUrl;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public void setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public void setConnectionTimeoutMs(long connectionTimeoutMs) {
    this.connectionTimeoutMs = connectionTimeoutMs;
  }

  public long getStatementTimeoutMs() {
    return statementTimeoutMs;
  }

  public void setStatementTimeoutMs(long statementTimeoutMs) {
    this.statementTimeoutMs = statementTimeoutMs;
  }

  public long getShutdownGracePeriodMs() {
    return shutdownGracePeriodMs;
  }

  public void setShutdownGracePeriodMs(long shutdownGracePeriodMs) {
    this.shutdownGracePeriodMs = shutdownGracePeriodMs;
  }

  public long getStopTimeoutMs() {
    return stopTimeoutMs;
  }

  public void setStopTimeoutMs(long stopTimeoutMs) {
    this.stopTimeoutMs = stopTimeoutMs;
  }

  public long getMaintenanceIntervalMs() {
    return maintenanceIntervalMs;
  }

  public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
    this.maintenanceIntervalMs = maintenanceIntervalMs;
  }

  public Health getHealth() {
    return health;
  }

  public static class Health {
    private int maxConsecutiveErrors = 10;
    private long unhealthyTimeoutMs = 120000;
    private long shutdownTimeoutMs = 30000;

    public int getMaxConsecutiveErrors() {
      return maxConsecutiveErrors;
    }

    public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
      this.maxConsecutiveErrors = maxConsecutiveErrors;
    }

    public long getUnhealthyTimeoutMs() {
      return unhealthyTimeoutMs;
    }

    public void setUnhealthyTimeoutMs(long unhealthyTimeoutMs) {
      this.unhealthyTimeoutMs = unhealthyTimeoutMs;
    }

    public long getShutdownTimeoutMs() {
      return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
      this.shutdownTimeoutMs = shutdownTimeoutMs;
    }
  }
}
