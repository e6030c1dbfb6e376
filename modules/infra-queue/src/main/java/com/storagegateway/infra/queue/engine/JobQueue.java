package com.storagegateway.infra.queue.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.storagegateway.infra.queue.errors.QueueException;
import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import com.storagegateway.infra.queue.observability.QueueTelemetry;
import com.storagegateway.infra.queue.store.JobInsert;
import com.storagegateway.infra.queue.store.QueueStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JobQueue {
  private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

  private final QueueStore store;
  private final HandlerRegistry registry;
  private final QueueTelemetry telemetry;
  private final QueueErrorListener errorListener;
  private final Duration shutdownGracePeriod;
  private final Duration stopTimeout;
  private final List<QueueWorker> workers = new ArrayList<>();
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  public JobQueue(
      QueueStore store,
      HandlerRegistry registry,
      QueueTelemetry telemetry,
      QueueErrorListener errorListener,
      Duration shutdownGracePeriod,
      Duration stopTimeout) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.errorListener = errorListener == null ? QueueErrorListener.NONE : errorListener;
    this.shutdownGracePeriod = Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod must not be null");
    this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout must not be null");
  }

  public void register(QueueEventHandler handler) {
    registry.register(handler);
  }

  public synchronized QueueStore start(QueueStartOptions options) {
    Objects.requireNonNull(options, "options must not be null");
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Queue already started");
    }
    registry.freeze();
    store.migrate();

    List<QueueEventHandler> handlers = registry.all();
    for (QueueEventHandler handler : handlers) {
      createQueues(handler);
      handler.onStart();
    }

    if (options.registerWorkers()) {
      CancellationSignal signal = options.signal();
      for (QueueEventHandler handler : handlers) {
        QueueWorker worker =
            new QueueWorker(
                handler,
                store,
                telemetry,
                signal,
                options.onMessage(),
                errorListener,
                new JobContext(handler, signal, this));
        workers.add(worker);
        worker.start();
      }
      signal.onCancel(() -> workers.forEach(QueueWorker::stopPolling));
    }
    log.info(
        "Queue started handlers={} workers={}",
        handlers.stream().map(QueueEventHandler::queueName).collect(Collectors.joining(",")),
        workers.size());
    return store;
  }

  public int insert(List<JobInsert> jobs) {
    ensureStarted();
    int inserted = store.insert(jobs);
    countScheduled(jobs);
    return inserted;
  }

  public Optional<UUID> send(JobInsert job) {
    ensureStarted();
    Optional<UUID> id = store.send(job);
    if (id.isPresent()) {
      telemetry.onJobsScheduled(job.name(), 1);
    }
    return id;
  }

  public Optional<UUID> sendToDeadLetterQueue(QueueEventHandler handler, JsonNode data) {
    Optional<UUID> id = send(JobInsert.of(handler.deadLetterQueueName(), data));
    telemetry.onDeadLetter(handler.queueName());
    return id;
  }

  public boolean isStarted() {
    return started.get() && !stopped.get();
  }

  public QueueStore store() {
    return store;
  }

  /** Stops polling, drains in-flight jobs and closes the store. Always returns within the stop timeout. */
  public void stop() {
    if (!started.get() || !stopped.compareAndSet(false, true)) {
      return;
    }
    CompletableFuture<Void> draining =
        CompletableFuture.runAsync(
            this::drain,
            runnable -> {
              Thread thread = new Thread(runnable, "queue-stop");
              thread.setDaemon(true);
              thread.start();
            });
    try {
      draining.get(stopTimeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Queue stopped");
    } catch (TimeoutException ex) {
      log.warn("Queue stop timed out timeout_ms={}", stopTimeout.toMillis());
    } catch (ExecutionException ex) {
      log.error("Queue stop failed error={}", ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage(), ex);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  List<QueueWorker> workers() {
    return workers;
  }

  private void drain() {
    workers.forEach(QueueWorker::stopPolling);
    for (QueueWorker worker : workers) {
      worker.awaitIdle(shutdownGracePeriod);
    }
    for (QueueEventHandler handler : registry.all()) {
      try {
        handler.onClose();
      } catch (RuntimeException ex) {
        log.warn("Queue handler close failed queue={} error={}", handler.queueName(), ex.getMessage());
      }
    }
    store.close();
  }

  private void createQueues(QueueEventHandler handler) {
    QueueOptions queueOptions = Objects.requireNonNullElseGet(handler.queueOptions(), QueueOptions::standard);
    String deadLetter = handler.deadLetterQueueName();
    boolean deadLetterCreated =
        store.createQueue(QueueOptions.standard().toDefinition(deadLetter, null));
    boolean queueCreated = store.createQueue(queueOptions.toDefinition(handler.queueName(), deadLetter));
    log.info(
        "Queue ensured queue={} policy={} created={} dead_letter={} dead_letter_created={}",
        handler.queueName(),
        queueOptions.policy().wireName(),
        queueCreated,
        deadLetter,
        deadLetterCreated);
  }

  private void countScheduled(List<JobInsert> jobs) {
    Map<String, Long> byQueue =
        jobs.stream().collect(Collectors.groupingBy(JobInsert::name, Collectors.counting()));
    byQueue.forEach((queue, count) -> telemetry.onJobsScheduled(queue, count.intValue()));
  }

  private void ensureStarted() {
    if (!started.get()) {
      throw new QueueException("Queue not started");
    }
    if (stopped.get()) {
      throw new QueueException("Queue stopped");
    }
  }
}
