package com.storagegateway.infra.queue.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerQueueTelemetry implements QueueTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerQueueTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onJobsScheduled(String queue, int count) {
    Counter.builder("queue.job.scheduled.total")
        .description("Jobs inserted into the queue store")
        .tag("queue", safeValue(queue))
        .register(meterRegistry)
        .increment(Math.max(0, count));
  }

  @Override
  public void onJobCompleted(String queue, long durationNanos) {
    Counter.builder("queue.job.completed.total")
        .description("Jobs handled successfully")
        .tag("queue", safeValue(queue))
        .register(meterRegistry)
        .increment();

    Timer.builder("queue.job.duration")
        .description("Job handler latency")
        .tag("queue", safeValue(queue))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onJobRetryFailed(String queue, Throwable error) {
    Counter.builder("queue.job.retry_failed.total")
        .description("Job attempts that failed and were handed back to the store")
        .tag("queue", safeValue(queue))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onJobError(String queue, Throwable error) {
    Counter.builder("queue.job.error.total")
        .description("Jobs that failed with no retries left")
        .tag("queue", safeValue(queue))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDeadLetter(String queue) {
    Counter.builder("queue.job.deadletter.total")
        .description("Jobs sent to a dead-letter queue explicitly")
        .tag("queue", safeValue(queue))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
