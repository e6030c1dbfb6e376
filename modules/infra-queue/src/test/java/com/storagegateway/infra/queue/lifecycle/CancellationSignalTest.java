package com.storagegateway.infra.queue.lifecycle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {
  @Test
  void shouldNotifyListenersOnceOnCancel() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(calls::incrementAndGet);

    signal.cancel();
    signal.cancel();

    assertTrue(signal.isCancelled());
    assertEquals(1, calls.get());
  }

  @Test
  void shouldRunLateListenerImmediately() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();
    AtomicInteger calls = new AtomicInteger();

    signal.onCancel(calls::incrementAndGet);

    assertEquals(1, calls.get());
  }

  @Test
  void shouldKeepNotifyingWhenListenerThrows() {
    CancellationSignal signal = new CancellationSignal();
    AtomicInteger calls = new AtomicInteger();
    signal.onCancel(
        () -> {
          throw new IllegalStateException("boom");
        });
    signal.onCancel(calls::incrementAndGet);

    signal.cancel();

    assertEquals(1, calls.get());
  }

  @Test
  void shouldWakeSleeperWhenCancelled() throws Exception {
    CancellationSignal signal = new CancellationSignal();
    Thread canceller =
        new Thread(
            () -> {
              try {
                Thread.sleep(50L);
              } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
              }
              signal.cancel();
            });
    canceller.start();

    long startedAt = System.nanoTime();
    boolean cancelled = signal.sleep(Duration.ofSeconds(10));

    assertTrue(cancelled);
    assertTrue(Duration.ofNanos(System.nanoTime() - startedAt).compareTo(Duration.ofSeconds(5)) < 0);
    canceller.join();
  }

  @Test
  void shouldReturnFalseWhenSleepElapses() {
    CancellationSignal signal = new CancellationSignal();

    assertFalse(signal.sleep(Duration.ofMillis(10)));
  }
}
