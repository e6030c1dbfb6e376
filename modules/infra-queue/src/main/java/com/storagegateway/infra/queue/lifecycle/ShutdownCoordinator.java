package com.storagegateway.infra.queue.lifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Owns the process-wide cancellation signal and the cleanup tasks awaited on shutdown. */
public class ShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ShutdownCoordinator.class);

  private final CancellationSignal signal = new CancellationSignal();
  private final Map<String, Runnable> cleanupTasks = new LinkedHashMap<>();
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  public CancellationSignal signal() {
    return signal;
  }

  public void register(String name, Runnable cleanupTask) {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(cleanupTask, "cleanupTask must not be null");
    synchronized (cleanupTasks) {
      if (shutdownStarted.get()) {
        throw new IllegalStateException("Shutdown already started, cannot register " + name);
      }
      cleanupTasks.put(name, cleanupTask);
    }
  }

  public boolean isShuttingDown() {
    return shutdownStarted.get();
  }

  /** Cancels the signal, then runs every cleanup task concurrently and waits up to {@code timeout}. */
  public void shutdown(Duration timeout) {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return;
    }
    signal.cancel();

    Map<String, Runnable> tasks;
    synchronized (cleanupTasks) {
      tasks = new LinkedHashMap<>(cleanupTasks);
    }
    ExecutorService executor =
        Executors.newCachedThreadPool(
            runnable -> {
              Thread thread = new Thread(runnable, "shutdown-cleanup");
              thread.setDaemon(true);
              return thread;
            });
    try {
      List<CompletableFuture<Void>> futures = new ArrayList<>();
      tasks.forEach((name, task) -> futures.add(CompletableFuture.runAsync(() -> runTask(name, task), executor)));
      CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
          .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info("Shutdown cleanup finished tasks={}", tasks.size());
    } catch (TimeoutException ex) {
      log.warn("Shutdown cleanup timed out timeout_ms={} tasks={}", timeout.toMillis(), tasks.keySet());
    } catch (ExecutionException ex) {
      log.error("Shutdown cleanup failed error={}", ex.getMessage(), ex);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
    } finally {
      executor.shutdown();
    }
  }

  private static void runTask(String name, Runnable task) {
    try {
      task.run();
      log.debug("Cleanup task finished task={}", name);
    } catch (RuntimeException ex) {
      log.error("Cleanup task failed task={} error={}", name, ex.getMessage(), ex);
    }
  }
}
