package com.storagegateway.infra.queue.engine;

import com.storagegateway.infra.queue.store.Job;

/**
 * A unit of background work bound to one named queue. Failures thrown from {@link #handle} are
 * recorded by the store, which retries the job until its retry limit is reached.
 */
public interface QueueEventHandler {
  String DEAD_LETTER_SUFFIX = "-dead-letter";

  String queueName();

  default String deadLetterQueueName() {
    return queueName() + DEAD_LETTER_SUFFIX;
  }

  default WorkerOptions workerOptions() {
    return WorkerOptions.defaults();
  }

  default QueueOptions queueOptions() {
    return QueueOptions.standard();
  }

  void handle(Job job, JobContext context) throws Exception;

  default void onStart() {}

  default void onClose() {}
}
