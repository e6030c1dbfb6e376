package com.storagegateway.infra.database.pool;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record PoolDefaults(int maxConnections, Duration connectionTimeout, List<String> searchPath) {
  public static final List<String> BASE_SEARCH_PATH = List.of("storage", "public", "extensions");

  public PoolDefaults {
    Objects.requireNonNull(connectionTimeout, "connectionTimeout must not be null");
    maxConnections = Math.max(1, maxConnections);
    searchPath = searchPath == null ? BASE_SEARCH_PATH : List.copyOf(searchPath);
  }

  public static List<String> searchPathWith(List<String> extraSchemas) {
    List<String> path = new ArrayList<>(BASE_SEARCH_PATH);
    if (extraSchemas != null) {
      extraSchemas.stream()
          .filter(schema -> schema != null && !schema.isBlank())
          .map(String::trim)
          .filter(schema -> !path.contains(schema))
          .forEach(path::add);
    }
    return List.copyOf(path);
  }
}
