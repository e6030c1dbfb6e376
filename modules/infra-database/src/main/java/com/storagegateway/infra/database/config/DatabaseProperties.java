package com.storagegateway.infra.database.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.database")
public class DatabaseProperties {
  private boolean multitenant;
  private String databaseUrl;
  private String databasePoolUrl;
  private Integer databasePoolMaxConnections;
  private String serviceKey = "";
  private int maxConnections = 20;
  private int clusterSize = 1;
  private long connectionTimeoutMs = 3_000L;
  private long multitenantPoolIdleTtlMs = 10_000L;
  // 0 keeps the single-tenant pool alive for the life of the process
  private long singleTenantPoolIdleTtlMs = 0L;
  private List<String> searchPath = new ArrayList<>();
  private TransactionRetry transactionRetry = new TransactionRetry();

  public boolean isMultitenant() {
    return multitenant;
  }

  public void setMultitenant(boolean multitenant) {
    this.multitenant = multitenant;
  }

  public String getDatabaseUrl() {
    return databaseUrl;
  }

  public void setDatabaseUrl(String databaseUrl) {
    this.databaseUrl = databaseUrl;
  }

  public String getDatabasePoolUrl() {
    return databasePoolUrl;
  }

  public void setDatabasePoolUrl(String databasePoolUrl) {
    this.databasePoolUrl = databasePoolUrl;
  }

  public Integer getDatabasePoolMaxConnections() {
    return databasePoolMaxConnections;
  }

  public void setDatabasePoolMaxConnections(Integer databasePoolMaxConnections) {
    this.databasePoolMaxConnections = databasePoolMaxConnections;
  }

  public String getServiceKey() {
    return serviceKey;
  }

  public void setServiceKey(String serviceKey) {
    this.serviceKey = serviceKey;
  }

  public int getMaxConnections() {
    return maxConnections;
  }

  public void setMaxConnections(int maxConnections) {
    this.maxConnections = maxConnections;
  }

  public int getClusterSize() {
    return clusterSize;
  }

  public void setClusterSize(int clusterSize) {
    this.clusterSize = clusterSize;
  }

  public long getConnectionTimeoutMs() {
    return connectionTimeoutMs;
  }

  public void setConnectionTimeoutMs(long connectionTimeoutMs) {
    this.connectionTimeoutMs = connectionTimeoutMs;
  }

  public long getMultitenantPoolIdleTtlMs() {
    return multitenantPoolIdleTtlMs;
  }

  public void setMultitenantPoolIdleTtlMs(long multitenantPoolIdleTtlMs) {
    this.multitenantPoolIdleTtlMs = multitenantPoolIdleTtlMs;
  }

  public long getSingleTenantPoolIdleTtlMs() {
    return singleTenantPoolIdleTtlMs;
  }

  public void setSingleTenantPoolIdleTtlMs(long singleTenantPoolIdleTtlMs) {
    this.singleTenantPoolIdleTtlMs = singleTenantPoolIdleTtlMs;
  }

  public List<String> getSearchPath() {
    return searchPath;
  }

  public void setSearchPath(List<String> searchPath) {
    this.searchPath = searchPath;
  }

  public TransactionRetry getTransactionRetry() {
    return transactionRetry;
  }

  public void setTransactionRetry(TransactionRetry transactionRetry) {
    this.transactionRetry = transactionRetry;
  }

  public int effectiveMaxConnections() {
    return Math.max(1, maxConnections / Math.max(1, clusterSize));
  }

  public long effectivePoolIdleTtlMs() {
    return multitenant ? multitenantPoolIdleTtlMs : singleTenantPoolIdleTtlMs;
  }

  public static class TransactionRetry {
    private long minDelayMs = 50L;
    private long maxDelayMs = 200L;
    private long maxElapsedMs = 3_000L;
    private int maxRetries = 10;

    public long getMinDelayMs() {
      return minDelayMs;
    }

    public void setMinDelayMs(long minDelayMs) {
      this.minDelayMs = minDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public long getMaxElapsedMs() {
      return maxElapsedMs;
    }

    public void setMaxElapsedMs(long maxElapsedMs) {
      this.maxElapsedMs = maxElapsedMs;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }
  }
}
