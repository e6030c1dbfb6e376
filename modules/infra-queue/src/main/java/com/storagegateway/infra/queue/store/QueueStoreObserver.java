package com.storagegateway.infra.queue.store;

public interface QueueStoreObserver {
  QueueStoreObserver NONE = new QueueStoreObserver() {};

  default void onSuccess(String operation) {}

  default void onError(String operation, RuntimeException error) {}
}
