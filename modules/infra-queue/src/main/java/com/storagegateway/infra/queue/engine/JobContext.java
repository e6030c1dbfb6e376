package com.storagegateway.infra.queue.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class JobContext {
  private final QueueEventHandler handler;
  private final CancellationSignal signal;
  private final JobQueue queue;

  JobContext(QueueEventHandler handler, CancellationSignal signal, JobQueue queue) {
    this.handler = Objects.requireNonNull(handler, "handler must not be null");
    this.signal = Objects.requireNonNull(signal, "signal must not be null");
    this.queue = Objects.requireNonNull(queue, "queue must not be null");
  }

  public CancellationSignal signal() {
    return signal;
  }

  public Optional<UUID> sendToDeadLetterQueue(JsonNode data) {
    return queue.sendToDeadLetterQueue(handler, data);
  }
}
