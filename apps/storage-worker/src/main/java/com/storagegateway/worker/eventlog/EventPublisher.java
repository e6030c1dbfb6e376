package com.storagegateway.worker.eventlog;

import com.storagegateway.domain.storage.eventlog.EventSignatureVerifier;
import com.storagegateway.infra.database.retry.ExponentialBackoff;
import com.storagegateway.infra.queue.engine.JobQueue;
import com.storagegateway.infra.queue.engine.QueueEventHandler;
import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import com.storagegateway.infra.queue.store.JobInsert;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Forwards signed rows of each tenant's {@code storage.event_log} into the job queue. Tenants with
 * pending rows are leased from the control plane with {@code SKIP LOCKED}, so several publishers
 * can run side by side; a row is deleted only after the queue accepted it.
 */
@Service
@ConditionalOnProperty(prefix = "storage.event-log", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EventPublisher {
  private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);
  private static final long MAX_BACKOFF_MS = 60_000L;

  private final TenantEventLogRepository eventLogRepository;
  private final TenantLeaseRepository leaseRepository;
  private final JobQueue jobQueue;
  private final EventSignatureVerifier signatureVerifier;
  private final EventLogPublisherProperties properties;
  private final MeterRegistry meterRegistry;
  private final int concurrency;
  private final Semaphore permits;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final List<Thread> loops = new ArrayList<>();
  private volatile CancellationSignal stopSignal = new CancellationSignal();
  private volatile ExecutorService tenantExecutor;
  private long coldCursor;

  public EventPublisher(
      TenantEventLogRepository eventLogRepository,
      TenantLeaseRepository leaseRepository,
      JobQueue jobQueue,
      EventSignatureVerifier signatureVerifier,
      EventLogPublisherProperties properties,
      MeterRegistry meterRegistry) {
    this.eventLogRepository = eventLogRepository;
    this.leaseRepository = leaseRepository;
    this.jobQueue = jobQueue;
    this.signatureVerifier = signatureVerifier;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.concurrency = Math.max(1, properties.getConcurrency());
    this.permits = new Semaphore(concurrency);
    this.tenantExecutor = newTenantExecutor(concurrency);
  }

  public synchronized void start(CancellationSignal signal) {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    if (stopSignal.isCancelled()) {
      stopSignal = new CancellationSignal();
    }
    if (tenantExecutor.isShutdown()) {
      tenantExecutor = newTenantExecutor(concurrency);
    }
    signal.onCancel(stopSignal::cancel);
    log.info(
        "Event log publisher starting batch_size={} concurrency={} prefetch_size={} poll_interval_ms={} warm_poll_delay_seconds={} lease_timeout_seconds={} multitenant={}",
        properties.getBatchSize(),
        properties.getConcurrency(),
        properties.getPrefetchSize(),
        properties.getPollIntervalMs(),
        properties.getWarmPollDelaySeconds(),
        properties.getLeaseTimeoutSeconds(),
        properties.isMultitenant());
    startLoop("event-log-poll", this::pollLoop);
    if (properties.isMultitenant()) {
      startLoop("event-log-sweep", this::sweepLoop);
    }
  }

  /** Stops both loops; a tenant batch already in progress is allowed to finish. */
  public void stop() {
    List<Thread> running;
    synchronized (this) {
      if (!started.compareAndSet(true, false)) {
        return;
      }
      stopSignal.cancel();
      running = new ArrayList<>(loops);
      loops.clear();
    }
    for (Thread loop : running) {
      try {
        loop.join(TimeUnit.SECONDS.toMillis(30));
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    tenantExecutor.shutdown();
    log.info("Event log publisher stopped");
  }

  public boolean isStarted() {
    return started.get();
  }

  void pollLoop() {
    ExponentialBackoff backoff = new ExponentialBackoff(properties.getPollIntervalMs(), MAX_BACKOFF_MS);
    CancellationSignal signal = stopSignal;
    int consecutiveFailures = 0;
    while (!signal.isCancelled()) {
      try {
        pollRegisteredTenants();
        consecutiveFailures = 0;
      } catch (RuntimeException ex) {
        consecutiveFailures++;
        loopFailure("poll", consecutiveFailures, ex);
      }
      signal.sleep(backoff.backoffAfterFailures(consecutiveFailures));
    }
  }

  void sweepLoop() {
    ExponentialBackoff backoff = new ExponentialBackoff(properties.getSweepIntervalMs(), MAX_BACKOFF_MS);
    CancellationSignal signal = stopSignal;
    int consecutiveFailures = 0;
    while (!signal.isCancelled()) {
      if (signal.sleep(backoff.backoffAfterFailures(consecutiveFailures))) {
        break;
      }
      try {
        sweepColdTenants();
        consecutiveFailures = 0;
      } catch (RuntimeException ex) {
        consecutiveFailures++;
        loopFailure("sweep", consecutiveFailures, ex);
      }
    }
  }

  void pollRegisteredTenants() {
    if (!properties.isMultitenant()) {
      String tenantId = properties.getTenantId();
      if (tenantId != null && !tenantId.isBlank()) {
        processTenant(tenantId);
      }
      return;
    }

    List<String> claimed =
        leaseRepository.claimDue(
            properties.getPrefetchSize(), Duration.ofSeconds(properties.getLeaseTimeoutSeconds()));
    if (claimed.isEmpty()) {
      return;
    }
    forEachBounded(
        claimed,
        tenantId -> {
          try {
            processTenant(tenantId);
          } catch (RuntimeException ex) {
            log.error("Event log tenant processing failed tenant_id={} error={}", tenantId, ex.getMessage(), ex);
          }
        });
  }

  void sweepColdTenants() {
    List<TenantCursor> tenants = leaseRepository.listTenants(coldCursor, properties.getSweepBatchSize());
    if (tenants.isEmpty()) {
      coldCursor = 0L;
      return;
    }
    coldCursor = tenants.get(tenants.size() - 1).cursorId();

    Set<String> withEvents = ConcurrentHashMap.newKeySet();
    forEachBounded(
        tenants.stream().map(TenantCursor::tenantId).toList(),
        tenantId -> {
          try {
            if (eventLogRepository.hasPending(tenantId)) {
              withEvents.add(tenantId);
            }
          } catch (RuntimeException ex) {
            log.warn("Event log cold sweep check failed tenant_id={} error={}", tenantId, ex.getMessage());
          }
        });

    if (!withEvents.isEmpty()) {
      int registered = leaseRepository.register(new ArrayList<>(withEvents));
      log.info(
          "Event log cold sweep registered tenants checked={} pending={} registered={}",
          tenants.size(),
          withEvents.size(),
          registered);
    }
  }

  void processTenant(String tenantId) {
    int batchSize = Math.max(1, properties.getBatchSize());
    List<EventLogRow> events = eventLogRepository.findPending(tenantId, batchSize);
    if (events.isEmpty()) {
      if (properties.isMultitenant()) {
        leaseRepository.remove(tenantId);
      }
      return;
    }

    List<JobInsert> jobs = new ArrayList<>(events.size());
    List<Long> forwardedIds = new ArrayList<>(events.size());
    List<Long> tamperedIds = new ArrayList<>();
    for (EventLogRow event : events) {
      if (!signatureVerifier.verify(event.eventName(), event.payload(), event.sendOptions(), event.signature())) {
        log.warn(
            "Event log signature mismatch, skipping tenant_id={} event_id={} event_name={}",
            tenantId,
            event.id(),
            event.eventName());
        tamperedIds.add(event.id());
        continue;
      }
      jobs.add(
          JobInsert.of(event.eventName(), event.payload())
              .withSendOptions(event.sendOptions())
              .withDeadLetter(event.eventName() + QueueEventHandler.DEAD_LETTER_SUFFIX));
      forwardedIds.add(event.id());
    }

    if (!tamperedIds.isEmpty()) {
      eventLogRepository.markSignatureInvalid(tenantId, tamperedIds);
      counter("event_log.tampered.total", "Event log rows rejected by signature check")
          .increment(tamperedIds.size());
    }
    if (jobs.isEmpty()) {
      return;
    }

    try {
      jobQueue.insert(jobs);
    } catch (RuntimeException ex) {
      // rows stay pending and are picked up again once the lease runs out
      counter("event_log.forward.failures.total", "Event log batches the queue rejected").increment();
      log.error(
          "Event log batch forward failed tenant_id={} count={} error={}",
          tenantId,
          jobs.size(),
          ex.getMessage(),
          ex);
      return;
    }

    eventLogRepository.deleteForwarded(tenantId, forwardedIds);
    counter("event_log.forwarded.total", "Event log rows forwarded to the queue").increment(forwardedIds.size());
    log.debug("Event log batch forwarded tenant_id={} count={}", tenantId, forwardedIds.size());

    if (properties.isMultitenant()) {
      Duration nextPoll =
          events.size() >= batchSize ? Duration.ZERO : Duration.ofSeconds(properties.getWarmPollDelaySeconds());
      leaseRepository.reschedule(tenantId, nextPoll);
    }
  }

  // permit taken before submit: never more than concurrency tenants in flight
  private void forEachBounded(List<String> tenantIds, Consumer<String> work) {
    ExecutorService executor = tenantExecutor;
    List<CompletableFuture<Void>> futures = new ArrayList<>(tenantIds.size());
    for (String tenantId : tenantIds) {
      if (stopSignal.isCancelled()) {
        break;
      }
      try {
        permits.acquire();
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        break;
      }
      try {
        futures.add(CompletableFuture.runAsync(() -> releaseAfter(tenantId, work), executor));
      } catch (RejectedExecutionException ex) {
        permits.release();
        log.warn("Event log tenant work rejected during shutdown tenant_id={}", tenantId);
        break;
      }
    }
    CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
  }

  private void releaseAfter(String tenantId, Consumer<String> work) {
    try {
      work.accept(tenantId);
    } finally {
      permits.release();
    }
  }

  private void loopFailure(String loop, int consecutiveFailures, RuntimeException ex) {
    Counter.builder("event_log.poll.failures.total")
        .description("Event log loop iterations that failed")
        .tag("loop", loop)
        .register(meterRegistry)
        .increment();
    log.error(
        "Event log {} loop failed consecutive_failures={} error={}",
        loop,
        consecutiveFailures,
        ex.getMessage(),
        ex);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(meterRegistry);
  }

  private synchronized void startLoop(String name, Runnable body) {
    Thread thread = daemonThreads(name).newThread(body);
    loops.add(thread);
    thread.start();
  }

  private static ExecutorService newTenantExecutor(int threads) {
    return Executors.newFixedThreadPool(threads, daemonThreads("event-log-tenant-"));
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix.endsWith("-") ? prefix + counter.incrementAndGet() : prefix);
      thread.setDaemon(true);
      return thread;
    };
  }
}
