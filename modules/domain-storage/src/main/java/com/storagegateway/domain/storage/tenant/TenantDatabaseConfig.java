package com.storagegateway.domain.storage.tenant;

import java.util.Objects;
import java.util.Optional;

public record TenantDatabaseConfig(
    String databaseUrl, String databasePoolUrl, Integer maxConnections, PoolMode poolMode) {

  public TenantDatabaseConfig {
    Objects.requireNonNull(databaseUrl, "databaseUrl must not be null");
    poolMode = poolMode == null ? PoolMode.INTERNAL : poolMode;
  }

  public Optional<String> poolUrl() {
    if (databasePoolUrl == null || databasePoolUrl.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(databasePoolUrl);
  }

  public enum PoolMode {
    INTERNAL,
    EXTERNAL
  }
}
