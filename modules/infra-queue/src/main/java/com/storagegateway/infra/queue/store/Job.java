package com.storagegateway.infra.queue.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

public record Job(
    UUID id,
    String name,
    JsonNode data,
    JobState state,
    int retryCount,
    int retryLimit,
    int retryDelaySeconds,
    boolean retryBackoff,
    int priority,
    String singletonKey,
    QueuePolicy policy,
    String deadLetter,
    Instant startAfter,
    Instant createdOn,
    Instant startedOn) {

  public boolean isLastAttempt() {
    return retryCount >= retryLimit;
  }
}
