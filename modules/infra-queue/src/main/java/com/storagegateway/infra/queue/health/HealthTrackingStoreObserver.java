package com.storagegateway.infra.queue.health;

import com.storagegateway.infra.queue.store.QueueStoreObserver;
import java.util.Objects;

/** Feeds every queue store call into the health monitor. Only store calls count towards health. */
public class HealthTrackingStoreObserver implements QueueStoreObserver {
  private final QueueHealthMonitor healthMonitor;

  public HealthTrackingStoreObserver(QueueHealthMonitor healthMonitor) {
    this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor must not be null");
  }

  @Override
  public void onSuccess(String operation) {
    healthMonitor.trackSuccessfulOperation();
  }

  @Override
  public void onError(String operation, RuntimeException error) {
    healthMonitor.trackConnectionError(error);
  }
}
