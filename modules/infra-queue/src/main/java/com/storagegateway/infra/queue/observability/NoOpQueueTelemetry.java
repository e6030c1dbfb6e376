package com.storagegateway.infra.queue.observability;

public class NoOpQueueTelemetry implements QueueTelemetry {
  @Override
  public void onJobsScheduled(String queue, int count) {}

  @Override
  public void onJobCompleted(String queue, long durationNanos) {}

  @Override
  public void onJobRetryFailed(String queue, Throwable error) {}

  @Override
  public void onJobError(String queue, Throwable error) {}

  @Override
  public void onDeadLetter(String queue) {}
}
