package com.storagegateway.infra.queue.health;

import java.time.Duration;
import java.util.Objects;

public record QueueHealthConfig(
    int maxConsecutiveErrors, Duration unhealthyTimeout, Duration shutdownTimeout) {
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  public QueueHealthConfig {
    maxConsecutiveErrors = Math.max(1, maxConsecutiveErrors);
    Objects.requireNonNull(unhealthyTimeout, "unhealthyTimeout must not be null");
    shutdownTimeout = shutdownTimeout == null ? DEFAULT_SHUTDOWN_TIMEOUT : shutdownTimeout;
  }

  public static QueueHealthConfig of(int maxConsecutiveErrors, Duration unhealthyTimeout) {
    return new QueueHealthConfig(maxConsecutiveErrors, unhealthyTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
  }
}
