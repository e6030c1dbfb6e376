package com.storagegateway.infra.queue.store;

import java.util.Locale;

public enum QueuePolicy {
  STANDARD,
  /** At most one queued (not yet started) job per singleton key. */
  SHORT,
  /** At most one active job per singleton key. */
  SINGLETON,
  /** At most one job per state per singleton key, up to active. */
  STATELY,
  /** At most one queued, retrying or active job per singleton key. */
  EXACTLY_ONCE;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static QueuePolicy fromWire(String value) {
    if (value == null || value.isBlank()) {
      return STANDARD;
    }
    return QueuePolicy.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
