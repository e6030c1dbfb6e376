package com.storagegateway.infra.queue.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** A job to insert. Null settings fall back to the target queue's defaults. */
public record JobInsert(
    UUID id,
    String name,
    JsonNode data,
    Integer priority,
    Integer retryLimit,
    Integer retryDelaySeconds,
    Boolean retryBackoff,
    Instant startAfter,
    String singletonKey,
    String deadLetter,
    Integer expireInSeconds) {

  public JobInsert {
    Objects.requireNonNull(name, "name must not be null");
    id = id == null ? UUID.randomUUID() : id;
  }

  public static JobInsert of(String name, JsonNode data) {
    return new JobInsert(null, name, data, null, null, null, null, null, null, null, null);
  }

  /**
   * Applies options stored alongside an event ({@code priority}, {@code retryLimit},
   * {@code retryDelay}, {@code retryBackoff}, {@code startAfter}, {@code singletonKey},
   * {@code expireInSeconds}, {@code deadLetter}); unknown keys are ignored.
   */
  public JobInsert withSendOptions(JsonNode options) {
    if (options == null || !options.isObject()) {
      return this;
    }
    return new JobInsert(
        id,
        name,
        data,
        intOption(options, "priority", priority),
        intOption(options, "retryLimit", retryLimit),
        intOption(options, "retryDelay", retryDelaySeconds),
        options.hasNonNull("retryBackoff") ? options.get("retryBackoff").asBoolean() : retryBackoff,
        options.hasNonNull("startAfter") ? parseInstant(options.get("startAfter").asText()) : startAfter,
        options.hasNonNull("singletonKey") ? options.get("singletonKey").asText() : singletonKey,
        options.hasNonNull("deadLetter") ? options.get("deadLetter").asText() : deadLetter,
        intOption(options, "expireInSeconds", expireInSeconds));
  }

  public JobInsert withDeadLetter(String deadLetterQueue) {
    return new JobInsert(
        id, name, data, priority, retryLimit, retryDelaySeconds, retryBackoff, startAfter,
        singletonKey, deadLetterQueue, expireInSeconds);
  }

  public JobInsert withSingletonKey(String key) {
    return new JobInsert(
        id, name, data, priority, retryLimit, retryDelaySeconds, retryBackoff, startAfter, key,
        deadLetter, expireInSeconds);
  }

  public JobInsert withRetry(int limit, int delaySeconds, boolean backoff) {
    return new JobInsert(
        id, name, data, priority, limit, delaySeconds, backoff, startAfter, singletonKey,
        deadLetter, expireInSeconds);
  }

  public JobInsert withPriority(int newPriority) {
    return new JobInsert(
        id, name, data, newPriority, retryLimit, retryDelaySeconds, retryBackoff, startAfter,
        singletonKey, deadLetter, expireInSeconds);
  }

  private static Integer intOption(JsonNode options, String field, Integer fallback) {
    JsonNode value = options.get(field);
    if (value == null || value.isNull() || !value.canConvertToInt()) {
      return fallback;
    }
    return value.asInt();
  }

  private static Instant parseInstant(String value) {
    try {
      return Instant.parse(value);
    } catch (RuntimeException ex) {
      return null;
    }
  }
}
