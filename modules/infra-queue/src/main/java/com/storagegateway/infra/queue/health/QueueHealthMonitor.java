package com.storagegateway.infra.queue.health;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts consecutive connection errors on the queue's data path. Once too many errors pile up,
 * or no operation has succeeded for too long, the queue is stopped once and the fatal handler is
 * invoked so the process can be restarted.
 */
public class QueueHealthMonitor {
  private static final Logger log = LoggerFactory.getLogger(QueueHealthMonitor.class);

  private final QueueHealthConfig config;
  private final Runnable queueStopper;
  private final FatalErrorHandler fatalErrorHandler;
  private final Clock clock;
  private final Executor shutdownExecutor;

  private int consecutiveConnectionErrors;
  private Instant lastSuccessfulOperation;
  private Instant lastError;
  private boolean shutdownStarted;

  public QueueHealthMonitor(
      QueueHealthConfig config, Runnable queueStopper, FatalErrorHandler fatalErrorHandler) {
    this(config, queueStopper, fatalErrorHandler, Clock.systemUTC(), QueueHealthMonitor::startShutdownThread);
  }

  QueueHealthMonitor(
      QueueHealthConfig config,
      Runnable queueStopper,
      FatalErrorHandler fatalErrorHandler,
      Clock clock,
      Executor shutdownExecutor) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.queueStopper = Objects.requireNonNull(queueStopper, "queueStopper must not be null");
    this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.shutdownExecutor = Objects.requireNonNull(shutdownExecutor, "shutdownExecutor must not be null");
    this.lastSuccessfulOperation = clock.instant();
  }

  public void trackConnectionError(Throwable error) {
    if (!ConnectionErrors.isConnectionError(error)) {
      return;
    }
    boolean unhealthy;
    synchronized (this) {
      consecutiveConnectionErrors++;
      lastError = clock.instant();
      Duration sinceSuccess = Duration.between(lastSuccessfulOperation, lastError);
      log.warn(
          "Queue connection error consecutive_errors={} since_last_success_ms={} error={}",
          consecutiveConnectionErrors,
          sinceSuccess.toMillis(),
          error.getMessage());
      unhealthy =
          consecutiveConnectionErrors >= config.maxConsecutiveErrors()
              || sinceSuccess.compareTo(config.unhealthyTimeout()) >= 0;
      if (unhealthy) {
        log.error(
            "Queue unhealthy, initiating graceful shutdown consecutive_errors={} unhealthy_seconds={} max_consecutive_errors={} unhealthy_timeout_ms={}",
            consecutiveConnectionErrors,
            sinceSuccess.toSeconds(),
            config.maxConsecutiveErrors(),
            config.unhealthyTimeout().toMillis());
      }
    }
    if (unhealthy) {
      initiateGracefulShutdown();
    }
  }

  public synchronized void trackSuccessfulOperation() {
    if (shutdownStarted) {
      return;
    }
    Instant now = clock.instant();
    if (consecutiveConnectionErrors > 0) {
      log.info(
          "Queue connection recovered previous_consecutive_errors={} downtime_seconds={}",
          consecutiveConnectionErrors,
          lastError == null ? 0L : Duration.between(lastError, now).toSeconds());
    }
    consecutiveConnectionErrors = 0;
    lastSuccessfulOperation = now;
  }

  public synchronized int consecutiveConnectionErrors() {
    return consecutiveConnectionErrors;
  }

  public synchronized Instant lastSuccessfulOperation() {
    return lastSuccessfulOperation;
  }

  public synchronized boolean isShutdownStarted() {
    return shutdownStarted;
  }

  private void initiateGracefulShutdown() {
    synchronized (this) {
      if (shutdownStarted) {
        return;
      }
      shutdownStarted = true;
    }
    shutdownExecutor.execute(this::stopQueueAndSignal);
  }

  private void stopQueueAndSignal() {
    log.info("Stopping queue to let in-flight jobs complete");
    CompletableFuture<Void> stopping = CompletableFuture.runAsync(queueStopper, QueueHealthMonitor::startShutdownThread);
    try {
      stopping.get(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
      log.error("Queue stopped, worker must restart");
    } catch (TimeoutException ex) {
      log.warn("Queue stop timed out timeout_ms={}", config.shutdownTimeout().toMillis());
    } catch (ExecutionException ex) {
      log.error("Queue stop failed during graceful shutdown error={}", ex.getMessage(), ex);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
    fatalErrorHandler.onFatalError(
        new QueueUnhealthyException("Queue health check failed, database connection unavailable"));
  }

  private static void startShutdownThread(Runnable runnable) {
    Thread thread = new Thread(runnable, "queue-health-shutdown");
    thread.setDaemon(true);
    thread.start();
  }
}
