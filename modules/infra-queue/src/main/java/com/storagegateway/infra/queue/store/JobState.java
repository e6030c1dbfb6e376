package com.storagegateway.infra.queue.store;

import java.util.Locale;

/** Declared in the same order as the database enum, which the policy indexes compare against. */
public enum JobState {
  CREATED,
  RETRY,
  ACTIVE,
  COMPLETED,
  CANCELLED,
  FAILED;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobState fromWire(String value) {
    return JobState.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
