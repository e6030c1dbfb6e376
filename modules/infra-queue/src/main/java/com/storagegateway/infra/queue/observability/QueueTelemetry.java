package com.storagegateway.infra.queue.observability;

public interface QueueTelemetry {
  void onJobsScheduled(String queue, int count);

  void onJobCompleted(String queue, long durationNanos);

  void onJobRetryFailed(String queue, Throwable error);

  void onJobError(String queue, Throwable error);

  void onDeadLetter(String queue);
}
