package com.storagegateway.infra.queue.health;

/** Receives the fatal signal once the queue was found unhealthy and stopped. */
@FunctionalInterface
public interface FatalErrorHandler {
  void onFatalError(Throwable error);
}
