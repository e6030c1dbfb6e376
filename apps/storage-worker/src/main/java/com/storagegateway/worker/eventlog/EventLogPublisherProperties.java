package com.storagegateway.worker.eventlog;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "storage.event-log")
public class EventLogPublisherProperties {
  private boolean enabled = true;
  private boolean multitenant;
  private String tenantId;
  private String signingKey;
  private int batchSize = 100;
  private int concurrency = 10;
  private int prefetchSize = 50;
  private long pollIntervalMs = 1_000L;
  private long warmPollDelaySeconds = 30L;
  private long leaseTimeoutSeconds = 60L;
  private int sweepBatchSize = 500;
  private long sweepIntervalMs = 30_000L;
  private long notifyFlushIntervalMs = 1_000L;

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

  public String getTenantId() {
    return tenantId;
  }

  public void setTenantId(String tenantId) {
    this.tenantId = tenantId;
  }

  public String getSigningKey() {
    return signingKey;
  }

  public void setSigningKey(String signingKey) {
    this.signingKey = signingKey;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public int getPrefetchSize() {
    return prefetchSize;
  }

  public void setPrefetchSize(int prefetchSize) {
    this.prefetchSize = prefetchSize;
  }

  public long getPollIntervalMs() {
    return pollIntervalMs;
  }

  public void setPollIntervalMs(long pollIntervalMs) {
    this.pollIntervalMs = pollIntervalMs;
  }

  public long getWarmPollDelaySeconds() {
    return warmPollDelaySeconds;
  }

  public void setWarmPollDelaySeconds(long warmPollDelaySeconds) {
    this.warmPollDelaySeconds = warmPollDelaySeconds;
  }

  public long getLeaseTimeoutSeconds() {
    return leaseTimeoutSeconds;
  }

  public void setLeaseTimeoutSeconds(long leaseTimeoutSeconds) {
    this.leaseTimeoutSeconds = leaseTimeoutSeconds;
  }

  public int getSweepBatchSize() {
    return sweepBatchSize;
  }

  public void setSweepBatchSize(int sweepBatchSize) {
    this.sweepBatchSize = sweepBatchSize;
  }

  public long getSweepIntervalMs() {
    return sweepIntervalMs;
  }

  public void setSweepIntervalMs(long sweepIntervalMs) {
    this.sweepIntervalMs = sweepIntervalMs;
  }

  public long getNotifyFlushIntervalMs() {
    return notifyFlushIntervalMs;
  }

  public void setNotifyFlushIntervalMs(long notifyFlushIntervalMs) {
    this.notifyFlushIntervalMs = notifyFlushIntervalMs;
  }
}
