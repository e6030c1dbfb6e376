package com.storagegateway.infra.database.retry;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RetryExecutor {
  private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);
  private static final String RETRY_COUNTER = "db.retry.attempts";
  private static final String EXHAUSTED_COUNTER = "db.retry.exhausted";

  private final String name;
  private final RetryPolicy policy;
  private final ExponentialBackoff backoff;
  private final Sleeper sleeper;
  private final Clock clock;
  private final MeterRegistry meterRegistry;

  public RetryExecutor(String name, RetryPolicy policy, MeterRegistry meterRegistry) {
    this(
        name,
        policy,
        policy.backoff(),
        duration -> Thread.sleep(duration.toMillis()),
        Clock.systemUTC(),
        meterRegistry);
  }

  public RetryExecutor(
      String name,
      RetryPolicy policy,
      ExponentialBackoff backoff,
      Sleeper sleeper,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(Operation<T> operation) throws Exception {
    Instant startedAt = clock.instant();
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (Exception ex) {
        if (!policy.isRetryable(ex)) {
          throw ex;
        }
        Duration wait = backoff.backoffForAttempt(attempt);
        Duration elapsed = Duration.between(startedAt, clock.instant());
        if (attempt > policy.maxRetries() || elapsed.plus(wait).compareTo(policy.maxElapsed()) > 0) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "operation", name).increment();
          log.warn(
              "Retry budget exhausted operation={} attempts={} elapsed_ms={} error={}",
              name,
              attempt,
              elapsed.toMillis(),
              ex.getMessage());
          throw ex;
        }
        meterRegistry.counter(RETRY_COUNTER, "operation", name).increment();
        log.debug("Retrying operation={} attempt={} wait_ms={}", name, attempt, wait.toMillis());
        sleep(wait);
        attempt++;
      }
    }
  }

  public RetryPolicy policy() {
    return policy;
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry backoff operation=" + name, interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run() throws Exception;
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
