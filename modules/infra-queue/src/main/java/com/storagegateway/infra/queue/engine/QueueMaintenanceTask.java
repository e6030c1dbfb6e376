package com.storagegateway.infra.queue.engine;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class QueueMaintenanceTask {
  private static final Logger log = LoggerFactory.getLogger(QueueMaintenanceTask.class);

  private final JobQueue jobQueue;

  public QueueMaintenanceTask(JobQueue jobQueue) {
    this.jobQueue = Objects.requireNonNull(jobQueue, "jobQueue must not be null");
  }

  @Scheduled(
      initialDelayString = "${infra.queue.maintenance-interval-ms:60000}",
      fixedDelayString = "${infra.queue.maintenance-interval-ms:60000}")
  public void runMaintenance() {
    if (!jobQueue.isStarted()) {
      return;
    }
    try {
      int expired = jobQueue.store().expireActive();
      int purged = jobQueue.store().purgeFinished();
      if (expired > 0 || purged > 0) {
        log.info("Queue maintenance finished expired_jobs={} purged_jobs={}", expired, purged);
      }
    } catch (RuntimeException ex) {
      log.warn("Queue maintenance failed error={}", ex.getMessage());
    }
  }
}
