package com.storagegateway.infra.queue.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.infra.queue.health.HealthTrackingStoreObserver;
import com.storagegateway.infra.queue.health.QueueHealthConfig;
import com.storagegateway.infra.queue.health.QueueHealthMonitor;
import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import com.storagegateway.infra.queue.observability.MicrometerQueueTelemetry;
import com.storagegateway.infra.queue.store.JdbcQueueStore;
import com.storagegateway.infra.queue.store.Job;
import com.storagegateway.infra.queue.store.QueueStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueueWorkerTest {
  private InMemoryQueueStore store;
  private SimpleMeterRegistry registry;
  private MicrometerQueueTelemetry telemetry;
  private CancellationSignal signal;
  private List<Throwable> listenerErrors;

  @BeforeEach
  void setUp() {
    store = new InMemoryQueueStore();
    registry = new SimpleMeterRegistry();
    telemetry = new MicrometerQueueTelemetry(registry);
    signal = new CancellationSignal();
    listenerErrors = new CopyOnWriteArrayList<>();
  }

  @Test
  void shouldCompleteJobWhenHandlerSucceeds() {
    Job job = store.enqueue("webhooks", 0, 3);
    List<Job> handled = new CopyOnWriteArrayList<>();
    QueueWorker worker = worker(new TestHandler("webhooks", WorkerOptions.of(2, 10), handled::add));

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(List.of(job), handled);
    assertEquals(List.of(job.id()), store.completed);
    assertEquals(1.0, registry.get("queue.job.completed.total").tag("queue", "webhooks").counter().count());
    assertTrue(listenerErrors.isEmpty());
  }

  @Test
  void shouldFailJobAndReportErrorWhenHandlerThrows() {
    Job job = store.enqueue("webhooks", 0, 3);
    QueueWorker worker =
        worker(
            new TestHandler(
                "webhooks",
                WorkerOptions.of(2, 10),
                ignored -> {
                  throw new IllegalStateException("endpoint down");
                }));

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(List.of(job.id()), store.failed);
    assertTrue(store.completed.isEmpty());
    assertEquals(1, listenerErrors.size());
    assertEquals("endpoint down", listenerErrors.get(0).getMessage());
    assertEquals(1.0, registry.get("queue.job.retry_failed.total").tag("queue", "webhooks").counter().count());
    assertTrue(registry.find("queue.job.error.total").counters().isEmpty());
  }

  @Test
  void shouldCountTerminalErrorOnLastAttempt() {
    store.enqueue("webhooks", 3, 3);
    QueueWorker worker =
        worker(
            new TestHandler(
                "webhooks",
                WorkerOptions.of(1, 1),
                ignored -> {
                  throw new IllegalStateException("still down");
                }));

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(1.0, registry.get("queue.job.error.total").tag("queue", "webhooks").counter().count());
  }

  @Test
  void shouldKeepProcessingSiblingsWhenOneJobFails() {
    Job failing = store.enqueue("webhooks", 0, 3);
    Job healthy = store.enqueue("webhooks", 0, 3);
    QueueWorker worker =
        worker(
            new TestHandler(
                "webhooks",
                WorkerOptions.of(2, 10),
                job -> {
                  if (job.id().equals(failing.id())) {
                    throw new IllegalStateException("boom");
                  }
                }));

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(List.of(failing.id()), store.failed);
    assertEquals(List.of(healthy.id()), store.completed);
  }

  @Test
  void shouldNotFetchBeyondBatchSize() throws Exception {
    for (int i = 0; i < 5; i++) {
      store.enqueue("backup-object", 0, 3);
    }
    CountDownLatch release = new CountDownLatch(1);
    QueueWorker worker =
        worker(
            new TestHandler(
                "backup-object",
                WorkerOptions.of(2, 2),
                ignored -> release.await(5, TimeUnit.SECONDS)));

    worker.pollOnce();
    worker.pollOnce();

    assertEquals(List.of(2), store.fetchLimits);
    assertEquals(2, worker.inFlight());
    release.countDown();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));
    assertEquals(2, store.completed.size());
  }

  @Test
  void shouldLimitConcurrentHandlers() {
    for (int i = 0; i < 6; i++) {
      store.enqueue("object-created", 0, 3);
    }
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    QueueWorker worker =
        worker(
            new TestHandler(
                "object-created",
                WorkerOptions.of(2, 6),
                ignored -> {
                  int now = running.incrementAndGet();
                  maxRunning.accumulateAndGet(now, Math::max);
                  Thread.sleep(30L);
                  running.decrementAndGet();
                }));

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertEquals(6, store.completed.size());
    assertTrue(maxRunning.get() <= 2);
  }

  @Test
  void shouldSkipFetchOnceSignalCancelled() {
    store.enqueue("webhooks", 0, 3);
    QueueWorker worker = worker(new TestHandler("webhooks", WorkerOptions.of(1, 1), ignored -> {}));
    signal.cancel();

    worker.pollOnce();

    assertTrue(store.fetchLimits.isEmpty());
  }

  @Test
  void shouldFailJobWhenMessageCallbackThrows() {
    Job job = store.enqueue("webhooks", 0, 3);
    List<Job> handled = new CopyOnWriteArrayList<>();
    QueueWorker worker =
        worker(
            new TestHandler("webhooks", WorkerOptions.of(1, 1), handled::add),
            ignored -> {
              throw new IllegalStateException("listener broke");
            });

    worker.pollOnce();
    assertTrue(worker.awaitIdle(Duration.ofSeconds(5)));

    assertTrue(handled.isEmpty());
    assertEquals(List.of(job.id()), store.failed);
    assertEquals("listener broke", listenerErrors.get(0).getMessage());
  }

  @Test
  void shouldCountFailedFetchOnceTowardsQueueHealth() throws Exception {
    DataSource unreachable = mock(DataSource.class);
    when(unreachable.getConnection())
        .thenThrow(new SQLTransientConnectionException("storage-queue - Connection is not available"));
    QueueHealthMonitor healthMonitor =
        new QueueHealthMonitor(
            new QueueHealthConfig(10, Duration.ofMinutes(2), Duration.ofSeconds(30)),
            () -> {},
            error -> {});
    JdbcQueueStore jdbcStore =
        new JdbcQueueStore(unreachable, new ObjectMapper(), new HealthTrackingStoreObserver(healthMonitor));
    CountDownLatch reported = new CountDownLatch(1);
    QueueErrorListener logging = new LoggingQueueErrorListener();
    TestHandler handler =
        new TestHandler("webhooks", new WorkerOptions(1, 1, Duration.ofHours(1)), ignored -> {});
    QueueWorker worker =
        new QueueWorker(
            handler,
            jdbcStore,
            telemetry,
            signal,
            job -> {},
            (queueName, error) -> {
              logging.onError(queueName, error);
              reported.countDown();
            },
            new JobContext(handler, signal, queueOver(jdbcStore)));

    worker.start();
    assertTrue(reported.await(5, TimeUnit.SECONDS));
    worker.stopPolling();

    assertEquals(1, healthMonitor.consecutiveConnectionErrors());
  }

  private QueueWorker worker(QueueEventHandler handler) {
    return worker(handler, job -> {});
  }

  private QueueWorker worker(QueueEventHandler handler, Consumer<Job> onMessage) {
    return new QueueWorker(
        handler,
        store,
        telemetry,
        signal,
        onMessage,
        (queueName, error) -> listenerErrors.add(error),
        new JobContext(handler, signal, queueOver(store)));
  }

  private JobQueue queueOver(QueueStore queueStore) {
    return new JobQueue(
        queueStore,
        new HandlerRegistry(),
        telemetry,
        QueueErrorListener.NONE,
        Duration.ofSeconds(1),
        Duration.ofSeconds(1));
  }

  @FunctionalInterface
  interface JobBody {
    void run(Job job) throws Exception;
  }

  static class TestHandler implements QueueEventHandler {
    private final String queueName;
    private final WorkerOptions options;
    private final JobBody body;

    TestHandler(String queueName, WorkerOptions options, JobBody body) {
      this.queueName = queueName;
      this.options = options;
      this.body = body;
    }

    @Override
    public String queueName() {
      return queueName;
    }

    @Override
    public WorkerOptions workerOptions() {
      return options;
    }

    @Override
    public void handle(Job job, JobContext context) throws Exception {
      body.run(job);
    }
  }
}
