package com.storagegateway.worker.eventlog;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Registers tenants that just wrote event-log rows so the publisher polls them without waiting
 * for the cold sweep. Best effort; the sweep still finds anything this misses.
 */
@Component
public class EventNotifier {
  private static final Logger log = LoggerFactory.getLogger(EventNotifier.class);
  static final int CHUNK_SIZE = 500;

  private final TenantLeaseRepository leaseRepository;
  private final EventLogPublisherProperties properties;
  private final AtomicReference<Set<String>> pending = new AtomicReference<>(ConcurrentHashMap.newKeySet());

  public EventNotifier(TenantLeaseRepository leaseRepository, EventLogPublisherProperties properties) {
    this.leaseRepository = leaseRepository;
    this.properties = properties;
  }

  public void notify(String tenantId) {
    if (!properties.isMultitenant() || tenantId == null) {
      return;
    }
    pending.get().add(tenantId);
  }

  @Scheduled(fixedDelayString = "${storage.event-log.notify-flush-interval-ms:1000}")
  public void flush() {
    Set<String> toFlush = pending.getAndSet(ConcurrentHashMap.newKeySet());
    if (toFlush.isEmpty()) {
      return;
    }
    List<String> batch = new ArrayList<>(Math.min(CHUNK_SIZE, toFlush.size()));
    for (String tenantId : toFlush) {
      batch.add(tenantId);
      if (batch.size() >= CHUNK_SIZE) {
        registerBatch(batch);
        batch = new ArrayList<>(CHUNK_SIZE);
      }
    }
    if (!batch.isEmpty()) {
      registerBatch(batch);
    }
  }

  int pendingCount() {
    return pending.get().size();
  }

  private void registerBatch(List<String> batch) {
    try {
      leaseRepository.register(batch);
    } catch (RuntimeException ex) {
      log.warn("Event log tenant notify failed count={} error={}", batch.size(), ex.getMessage());
    }
  }
}
