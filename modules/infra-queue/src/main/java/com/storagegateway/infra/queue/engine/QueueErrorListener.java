package com.storagegateway.infra.queue.engine;

@FunctionalInterface
public interface QueueErrorListener {
  QueueErrorListener NONE = (queue, error) -> {};

  void onError(String queue, Throwable error);
}
