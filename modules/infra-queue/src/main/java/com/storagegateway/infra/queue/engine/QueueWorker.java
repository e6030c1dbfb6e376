package com.storagegateway.infra.queue.engine;

import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import com.storagegateway.infra.queue.observability.QueueTelemetry;
import com.storagegateway.infra.queue.store.Job;
import com.storagegateway.infra.queue.store.QueueStore;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls one queue on its own timer thread. At most {@code batchSize} jobs are in flight and at
 * most {@code concurrency} of them run the handler at the same time.
 */
class QueueWorker {
  private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

  private final QueueEventHandler handler;
  private final String queueName;
  private final WorkerOptions options;
  private final QueueStore store;
  private final QueueTelemetry telemetry;
  private final CancellationSignal signal;
  private final Consumer<Job> onMessage;
  private final QueueErrorListener errorListener;
  private final JobContext context;
  private final Semaphore permits;
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicBoolean polling = new AtomicBoolean(false);
  private final ScheduledExecutorService timer;
  private final ExecutorService jobExecutor;

  QueueWorker(
      QueueEventHandler handler,
      QueueStore store,
      QueueTelemetry telemetry,
      CancellationSignal signal,
      Consumer<Job> onMessage,
      QueueErrorListener errorListener,
      JobContext context) {
    this.handler = Objects.requireNonNull(handler, "handler must not be null");
    this.queueName = handler.queueName();
    this.options = Objects.requireNonNullElseGet(handler.workerOptions(), WorkerOptions::defaults);
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.signal = Objects.requireNonNull(signal, "signal must not be null");
    this.onMessage = Objects.requireNonNull(onMessage, "onMessage must not be null");
    this.errorListener = Objects.requireNonNull(errorListener, "errorListener must not be null");
    this.context = Objects.requireNonNull(context, "context must not be null");
    this.permits = new Semaphore(options.concurrency());
    this.timer = Executors.newSingleThreadScheduledExecutor(threads("queue-timer-" + queueName + "-"));
    this.jobExecutor = Executors.newCachedThreadPool(threads("queue-job-" + queueName + "-"));
  }

  void start() {
    if (!polling.compareAndSet(false, true)) {
      return;
    }
    long intervalMs = options.pollingInterval().toMillis();
    timer.scheduleWithFixedDelay(this::pollSafely, 0L, intervalMs, TimeUnit.MILLISECONDS);
    log.info(
        "Queue worker started queue={} concurrency={} batch_size={} polling_interval_ms={}",
        queueName,
        options.concurrency(),
        options.batchSize(),
        intervalMs);
  }

  void stopPolling() {
    polling.set(false);
    timer.shutdownNow();
  }

  /** Waits for in-flight jobs; handlers still running after the grace period are left to finish. */
  boolean awaitIdle(Duration gracePeriod) {
    jobExecutor.shutdown();
    try {
      boolean drained = jobExecutor.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
      if (!drained) {
        log.warn("Queue worker drain timed out queue={} in_flight={}", queueName, inFlight.get());
      }
      return drained;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  int inFlight() {
    return inFlight.get();
  }

  String queueName() {
    return queueName;
  }

  void pollOnce() {
    if (signal.isCancelled()) {
      return;
    }
    int capacity = options.batchSize() - inFlight.get();
    if (capacity <= 0) {
      return;
    }
    List<Job> jobs = store.fetch(queueName, capacity);
    for (Job job : jobs) {
      inFlight.incrementAndGet();
      try {
        jobExecutor.execute(() -> runJob(job));
      } catch (RejectedExecutionException ex) {
        inFlight.decrementAndGet();
        log.warn("Queue job rejected during shutdown queue={} job_id={}", queueName, job.id());
      }
    }
  }

  private void pollSafely() {
    if (!polling.get()) {
      return;
    }
    try {
      pollOnce();
    } catch (RuntimeException ex) {
      log.warn("Queue fetch failed queue={} error={}", queueName, ex.getMessage());
      errorListener.onError(queueName, ex);
    }
  }

  private void runJob(Job job) {
    boolean acquired = false;
    try {
      permits.acquire();
      acquired = true;
      process(job);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Queue job interrupted before start queue={} job_id={}", queueName, job.id());
    } catch (Exception ex) {
      errorListener.onError(queueName, ex);
    } finally {
      if (acquired) {
        permits.release();
      }
      inFlight.decrementAndGet();
    }
  }

  private void process(Job job) throws Exception {
    long startedAt = System.nanoTime();
    try {
      onMessage.accept(job);
      handler.handle(job, context);
      store.complete(queueName, job.id());
      telemetry.onJobCompleted(queueName, System.nanoTime() - startedAt);
    } catch (Exception ex) {
      try {
        store.fail(queueName, job.id(), ex);
      } catch (RuntimeException failError) {
        ex.addSuppressed(failError);
      }
      telemetry.onJobRetryFailed(queueName, ex);
      if (job.isLastAttempt()) {
        telemetry.onJobError(queueName, ex);
      }
      log.error(
          "Queue job failed queue={} job_id={} retry_count={} retry_limit={} error={}",
          queueName,
          job.id(),
          job.retryCount(),
          job.retryLimit(),
          ex.getMessage(),
          ex);
      throw ex;
    }
  }

  private static ThreadFactory threads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
