package com.storagegateway.infra.queue.store;

import java.util.Objects;

public record QueueDefinition(
    String name,
    QueuePolicy policy,
    int retryLimit,
    int retryDelaySeconds,
    boolean retryBackoff,
    int expireInSeconds,
    int retentionMinutes,
    String deadLetter) {

  public QueueDefinition {
    Objects.requireNonNull(name, "name must not be null");
    policy = policy == null ? QueuePolicy.STANDARD : policy;
    retryLimit = Math.max(0, retryLimit);
    retryDelaySeconds = Math.max(0, retryDelaySeconds);
    expireInSeconds = Math.max(1, expireInSeconds);
    retentionMinutes = Math.max(1, retentionMinutes);
  }
}
