package com.storagegateway.infra.queue.engine;

import com.storagegateway.infra.queue.lifecycle.CancellationSignal;
import com.storagegateway.infra.queue.store.Job;
import java.util.Objects;
import java.util.function.Consumer;

public record QueueStartOptions(
    CancellationSignal signal, Consumer<Job> onMessage, boolean registerWorkers) {

  public QueueStartOptions {
    Objects.requireNonNull(signal, "signal must not be null");
    onMessage = onMessage == null ? job -> {} : onMessage;
  }

  public static QueueStartOptions producerOnly(CancellationSignal signal) {
    return new QueueStartOptions(signal, null, false);
  }

  public static QueueStartOptions withWorkers(CancellationSignal signal, Consumer<Job> onMessage) {
    return new QueueStartOptions(signal, onMessage, true);
  }
}
