package com.storagegateway.infra.database.connection;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

public record TenantConnectionOptions(
    String tenantId,
    String dbUrl,
    boolean externalPool,
    Integer maxConnections,
    DatabaseUser user,
    DatabaseUser superUser,
    Map<String, String> headers,
    String method,
    String path,
    Supplier<String> operation) {

  public TenantConnectionOptions {
    Objects.requireNonNull(tenantId, "tenantId must not be null");
    Objects.requireNonNull(dbUrl, "dbUrl must not be null");
    Objects.requireNonNull(user, "user must not be null");
    Objects.requireNonNull(superUser, "superUser must not be null");
    headers = headers == null ? Map.of() : Map.copyOf(headers);
    method = Objects.requireNonNullElse(method, "");
    path = Objects.requireNonNullElse(path, "");
    operation = operation == null ? () -> "" : operation;
  }

  public static TenantConnectionOptions of(
      String tenantId, String dbUrl, DatabaseUser user, DatabaseUser superUser) {
    return new TenantConnectionOptions(
        tenantId, dbUrl, false, null, user, superUser, Map.of(), "", "", null);
  }

  public TenantConnectionOptions asExternalPool(Integer poolMaxConnections) {
    return new TenantConnectionOptions(
        tenantId, dbUrl, true, poolMaxConnections, user, superUser, headers, method, path, operation);
  }

  public TenantConnectionOptions withRequest(
      Map<String, String> newHeaders, String newMethod, String newPath, Supplier<String> newOperation) {
    return new TenantConnectionOptions(
        tenantId, dbUrl, externalPool, maxConnections, user, superUser, newHeaders, newMethod, newPath, newOperation);
  }
}
