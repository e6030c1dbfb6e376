package com.storagegateway.infra.queue.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class HandlerRegistry {
  private final Map<String, QueueEventHandler> handlers = new LinkedHashMap<>();
  private boolean frozen;

  public synchronized void register(QueueEventHandler handler) {
    Objects.requireNonNull(handler, "handler must not be null");
    if (frozen) {
      throw new IllegalStateException("Queue already started, cannot register " + handler.queueName());
    }
    String queueName = handler.queueName();
    if (queueName == null || queueName.isBlank()) {
      throw new IllegalArgumentException("handler queueName must not be blank");
    }
    if (handlers.containsKey(queueName)) {
      throw new IllegalArgumentException("Handler already registered for queue " + queueName);
    }
    handlers.put(queueName, handler);
  }

  public synchronized Optional<QueueEventHandler> find(String queueName) {
    return Optional.ofNullable(handlers.get(queueName));
  }

  public synchronized List<QueueEventHandler> all() {
    return new ArrayList<>(handlers.values());
  }

  public synchronized boolean isFrozen() {
    return frozen;
  }

  synchronized void freeze() {
    frozen = true;
  }
}
