package com.storagegateway.infra.queue.store;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface QueueStore {
  void migrate();

  /** Returns {@code false} when the queue already existed. */
  boolean createQueue(QueueDefinition definition);

  /** Inserts all jobs in one statement. Jobs rejected by a queue policy are skipped. */
  int insert(List<JobInsert> jobs);

  Optional<UUID> send(JobInsert job);

  /** Claims up to {@code limit} due jobs and marks them active. */
  List<Job> fetch(String queue, int limit);

  boolean complete(String queue, UUID jobId);

  /** Schedules a retry or, with no retries left, fails the job and copies it to its dead-letter queue. */
  Optional<JobState> fail(String queue, UUID jobId, Throwable error);

  int expireActive();

  int purgeFinished();

  void close();
}
