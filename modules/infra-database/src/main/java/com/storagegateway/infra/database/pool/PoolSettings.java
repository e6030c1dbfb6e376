package com.storagegateway.infra.database.pool;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record PoolSettings(
    String dbUrl,
    boolean external,
    int maxConnections,
    Duration connectionTimeout,
    List<String> searchPath) {

  public PoolSettings {
    Objects.requireNonNull(dbUrl, "dbUrl must not be null");
    Objects.requireNonNull(connectionTimeout, "connectionTimeout must not be null");
    maxConnections = Math.max(1, maxConnections);
    searchPath = searchPath == null ? List.of() : List.copyOf(searchPath);
  }
}
