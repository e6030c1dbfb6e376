package com.storagegateway.infra.queue.engine;

import com.storagegateway.infra.queue.store.QueueDefinition;
import com.storagegateway.infra.queue.store.QueuePolicy;
import java.time.Duration;

public record QueueOptions(
    QueuePolicy policy,
    int retryLimit,
    int retryDelaySeconds,
    boolean retryBackoff,
    Duration expireIn,
    Duration retention) {

  public QueueOptions {
    policy = policy == null ? QueuePolicy.STANDARD : policy;
    expireIn = expireIn == null ? Duration.ofHours(48) : expireIn;
    retention = retention == null ? Duration.ofDays(14) : retention;
  }

  public static QueueOptions standard() {
    return new QueueOptions(QueuePolicy.STANDARD, 20, 1, true, Duration.ofHours(48), Duration.ofDays(14));
  }

  public QueueOptions withPolicy(QueuePolicy newPolicy) {
    return new QueueOptions(newPolicy, retryLimit, retryDelaySeconds, retryBackoff, expireIn, retention);
  }

  public QueueOptions withRetry(int limit, int delaySeconds, boolean backoff) {
    return new QueueOptions(policy, limit, delaySeconds, backoff, expireIn, retention);
  }

  public QueueOptions withExpireIn(Duration newExpireIn) {
    return new QueueOptions(policy, retryLimit, retryDelaySeconds, retryBackoff, newExpireIn, retention);
  }

  QueueDefinition toDefinition(String name, String deadLetter) {
    return new QueueDefinition(
        name,
        policy,
        retryLimit,
        retryDelaySeconds,
        retryBackoff,
        (int) Math.min(Integer.MAX_VALUE, expireIn.toSeconds()),
        (int) Math.min(Integer.MAX_VALUE, retention.toMinutes()),
        deadLetter);
  }
}
