package com.storagegateway.infra.database.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

public record RetryPolicy(
    Duration minDelay,
    Duration maxDelay,
    Duration maxElapsed,
    int maxRetries,
    Predicate<Throwable> retryable) {

  public RetryPolicy {
    Objects.requireNonNull(minDelay, "minDelay must not be null");
    Objects.requireNonNull(maxDelay, "maxDelay must not be null");
    Objects.requireNonNull(maxElapsed, "maxElapsed must not be null");
    Objects.requireNonNull(retryable, "retryable must not be null");
    if (minDelay.isNegative() || maxDelay.compareTo(minDelay) < 0) {
      throw new IllegalArgumentException("maxDelay must be >= minDelay >= 0");
    }
    maxRetries = Math.max(0, maxRetries);
  }

  public static RetryPolicy never() {
    return new RetryPolicy(Duration.ZERO, Duration.ZERO, Duration.ZERO, 0, error -> false);
  }

  public boolean isRetryable(Throwable error) {
    return error != null && retryable.test(error);
  }

  public ExponentialBackoff backoff() {
    return new ExponentialBackoff(minDelay.toMillis(), maxDelay.toMillis(), true);
  }
}
