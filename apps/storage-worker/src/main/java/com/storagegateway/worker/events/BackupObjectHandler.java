package com.storagegateway.worker.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.storagegateway.domain.storage.backend.StorageBackendAdapter;
import com.storagegateway.infra.queue.engine.JobContext;
import com.storagegateway.infra.queue.engine.QueueEventHandler;
import com.storagegateway.infra.queue.engine.QueueOptions;
import com.storagegateway.infra.queue.engine.WorkerOptions;
import com.storagegateway.infra.queue.store.Job;
import com.storagegateway.infra.queue.store.QueuePolicy;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies one object version to the internal backup prefix and, when asked, deletes the original.
 * One backup per tenant runs at a time.
 */
public class BackupObjectHandler implements QueueEventHandler {
  public static final String QUEUE_NAME = "backup-object";
  private static final Logger log = LoggerFactory.getLogger(BackupObjectHandler.class);

  private final StorageBackendAdapter backend;
  private final BackupProperties properties;

  public BackupObjectHandler(StorageBackendAdapter backend, BackupProperties properties) {
    this.backend = backend;
    this.properties = properties;
  }

  @Override
  public String queueName() {
    return QUEUE_NAME;
  }

  @Override
  public WorkerOptions workerOptions() {
    return new WorkerOptions(5, 10, WorkerOptions.DEFAULT_POLLING_INTERVAL);
  }

  @Override
  public QueueOptions queueOptions() {
    return QueueOptions.standard()
        .withPolicy(QueuePolicy.SINGLETON)
        .withRetry(5, 5, true)
        .withExpireIn(Duration.ofHours(1));
  }

  @Override
  public void handle(Job job, JobContext context) {
    String bucket = properties.getBucket();
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalStateException("Backup bucket not configured");
    }
    JsonNode data = job.data();
    String tenantId = data.path("tenant").path("ref").asText("");
    String version = data.path("version").asText(null);
    String sourceKey = tenantId + "/" + data.path("bucketId").asText("") + "/" + data.path("name").asText("");
    String destinationKey = properties.getKeyPrefix() + "/" + sourceKey;

    log.info(
        "Backup object started tenant_id={} object_key={} version={} job_id={}",
        tenantId,
        sourceKey,
        version,
        job.id());
    backend.copy(bucket, sourceKey, version, destinationKey, version);

    if (data.path("deleteOriginal").asBoolean(false)) {
      log.info("Backup object deleting original tenant_id={} object_key={} version={}", tenantId, sourceKey, version);
      backend.delete(bucket, sourceKey, version);
    }
  }
}
