package com.storagegateway.infra.queue.lifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CancellationSignal {
  private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

  private final CountDownLatch latch = new CountDownLatch(1);
  private final List<Runnable> listeners = new ArrayList<>();

  public void cancel() {
    List<Runnable> toNotify;
    synchronized (listeners) {
      if (isCancelled()) {
        return;
      }
      latch.countDown();
      toNotify = List.copyOf(listeners);
      listeners.clear();
    }
    for (Runnable listener : toNotify) {
      notifyListener(listener);
    }
  }

  public boolean isCancelled() {
    return latch.getCount() == 0L;
  }

  /** Runs the listener once on cancellation, immediately when already cancelled. */
  public void onCancel(Runnable listener) {
    Objects.requireNonNull(listener, "listener must not be null");
    synchronized (listeners) {
      if (!isCancelled()) {
        listeners.add(listener);
        return;
      }
    }
    notifyListener(listener);
  }

  /** Sleeps up to {@code timeout}; returns {@code true} as soon as the signal is cancelled. */
  public boolean sleep(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return isCancelled();
    }
    try {
      return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return true;
    }
  }

  private static void notifyListener(Runnable listener) {
    try {
      listener.run();
    } catch (RuntimeException ex) {
      log.warn("Cancellation listener failed error={}", ex.getMessage(), ex);
    }
  }
}
