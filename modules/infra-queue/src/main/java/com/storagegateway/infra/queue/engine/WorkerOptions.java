package com.storagegateway.infra.queue.engine;

import java.time.Duration;
import java.util.Objects;

public record WorkerOptions(int concurrency, int batchSize, Duration pollingInterval) {
  public static final Duration DEFAULT_POLLING_INTERVAL = Duration.ofSeconds(2);

  public WorkerOptions {
    concurrency = Math.max(1, concurrency);
    batchSize = Math.max(1, batchSize);
    Objects.requireNonNull(pollingInterval, "pollingInterval must not be null");
    if (pollingInterval.isZero() || pollingInterval.isNegative()) {
      pollingInterval = DEFAULT_POLLING_INTERVAL;
    }
  }

  public static WorkerOptions defaults() {
    return new WorkerOptions(5, 10, DEFAULT_POLLING_INTERVAL);
  }

  public static WorkerOptions of(int concurrency, int batchSize) {
    return new WorkerOptions(concurrency, batchSize, DEFAULT_POLLING_INTERVAL);
  }
}
