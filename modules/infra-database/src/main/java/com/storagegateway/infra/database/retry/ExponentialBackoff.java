package com.storagegateway.infra.database.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class ExponentialBackoff {
  private final long baseBackoffMs;
  private final long maxBackoffMs;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public ExponentialBackoff(long baseBackoffMs, long maxBackoffMs) {
    this(baseBackoffMs, maxBackoffMs, false, () -> 0.0d);
  }

  public ExponentialBackoff(long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled) {
    this(baseBackoffMs, maxBackoffMs, jitterEnabled, () -> ThreadLocalRandom.current().nextDouble());
  }

  public ExponentialBackoff(
      long baseBackoffMs, long maxBackoffMs, boolean jitterEnabled, DoubleSupplier jitterSource) {
    this.baseBackoffMs = Math.max(0L, baseBackoffMs);
    this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  /** Attempt 1 waits the base delay, every further attempt doubles it up to the cap. */
  public Duration backoffForAttempt(int attempt) {
    long deterministic = deterministicBackoff(attempt);
    if (!jitterEnabled || deterministic <= baseBackoffMs) {
      return Duration.ofMillis(deterministic);
    }
    // jitter only within [base, deterministic] so the floor never drops below the base delay
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    long spread = deterministic - baseBackoffMs;
    long jittered = baseBackoffMs + (long) Math.floor(factor * (spread + 1L));
    return Duration.ofMillis(Math.min(maxBackoffMs, jittered));
  }

  public Duration backoffAfterFailures(int consecutiveFailures) {
    return backoffForAttempt(Math.max(0, consecutiveFailures) + 1);
  }

  public Duration baseBackoff() {
    return Duration.ofMillis(baseBackoffMs);
  }

  public Duration maxBackoff() {
    return Duration.ofMillis(maxBackoffMs);
  }

  private long deterministicBackoff(int attempt) {
    if (baseBackoffMs == 0L) {
      return 0L;
    }
    int exponent = Math.max(0, attempt - 1);
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    long bounded = (long) Math.floor(Math.min((double) maxBackoffMs, scaled));
    return Math.max(0L, bounded);
  }
}
