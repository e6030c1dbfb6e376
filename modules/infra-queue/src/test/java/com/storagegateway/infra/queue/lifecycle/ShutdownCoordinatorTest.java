package com.storagegateway.infra.queue.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ShutdownCoordinatorTest {
  @Test
  void shouldCancelSignalAndRunCleanupTasks() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    AtomicInteger cleaned = new AtomicInteger();
    coordinator.register("queue", cleaned::incrementAndGet);
    coordinator.register("pools", cleaned::incrementAndGet);

    coordinator.shutdown(Duration.ofSeconds(5));

    assertTrue(coordinator.signal().isCancelled());
    assertTrue(coordinator.isShuttingDown());
    assertEquals(2, cleaned.get());
  }

  @Test
  void shouldReturnWithinTimeoutWhenTaskHangs() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    CountDownLatch never = new CountDownLatch(1);
    coordinator.register(
        "stuck",
        () -> {
          try {
            never.await();
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
          }
        });

    long startedAt = System.nanoTime();
    coordinator.shutdown(Duration.ofMillis(200));

    assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(5)) < 0);
    never.countDown();
  }

  @Test
  void shouldRunRemainingTasksWhenOneFails() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    AtomicInteger cleaned = new AtomicInteger();
    coordinator.register(
        "broken",
        () -> {
          throw new IllegalStateException("boom");
        });
    coordinator.register("healthy", cleaned::incrementAndGet);

    coordinator.shutdown(Duration.ofSeconds(5));

    assertEquals(1, cleaned.get());
  }

  @Test
  void shouldRejectRegistrationAfterShutdown() {
    ShutdownCoordinator coordinator = new ShutdownCoordinator();
    coordinator.shutdown(Duration.ofSeconds(1));

    assertThrows(IllegalStateException.class, () -> coordinator.register("late", () -> {}));
  }
}
