package com.storagegateway.infra.database.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.infra.database.errors.DatabaseErrors;
import com.storagegateway.infra.database.errors.DatabaseException;
import com.storagegateway.infra.database.errors.DatabaseTimeoutException;
import com.storagegateway.infra.database.pool.TenantPool;
import com.storagegateway.infra.database.retry.RetryExecutor;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TenantConnection {
  private static final Logger log = LoggerFactory.getLogger(TenantConnection.class);

  static final String SET_SEARCH_PATH_SQL = "SELECT set_config('search_path', ?, true)";
  static final String SET_SCOPE_SQL =
      """
      SELECT
        set_config('role', ?, true),
        set_config('request.jwt.claim.role', ?, true),
        set_config('request.jwt', ?, true),
        set_config('request.jwt.claim.sub', ?, true),
        set_config('request.jwt.claims', ?, true),
        set_config('request.headers', ?, true),
        set_config('request.method', ?, true),
        set_config('request.path', ?, true),
        set_config('storage.operation', ?, true)
      """;

  private final TenantPool pool;
  private final TenantConnectionOptions options;
  private final RetryExecutor acquireRetry;
  private final ObjectMapper objectMapper;

  public TenantConnection(
      TenantPool pool,
      TenantConnectionOptions options,
      RetryExecutor acquireRetry,
      ObjectMapper objectMapper) {
    this.pool = Objects.requireNonNull(pool, "pool must not be null");
    this.options = Objects.requireNonNull(options, "options must not be null");
    this.acquireRetry = Objects.requireNonNull(acquireRetry, "acquireRetry must not be null");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String tenantId() {
    return options.tenantId();
  }

  public TenantConnectionOptions options() {
    return options;
  }

  public TenantPool pool() {
    return pool;
  }

  public TenantTransaction transaction() {
    return transaction(null);
  }

  public TenantTransaction transaction(TenantTransaction parent) {
    TenantTransaction transaction;
    try {
      transaction =
          acquireRetry.execute(
              () ->
                  parent != null
                      ? parent.nested()
                      : TenantTransaction.begin(pool.dataSource().getConnection()));
    } catch (DatabaseException ex) {
      throw ex;
    } catch (Exception ex) {
      throw translate(ex);
    }

    if (parent == null && pool.isExternal()) {
      prepareExternalPoolTransaction(transaction);
    }
    return transaction;
  }

  public void setScope(TenantTransaction transaction) {
    Objects.requireNonNull(transaction, "transaction must not be null");
    DatabaseUser user = options.user();
    String role = user.role();
    try {
      transaction
          .jdbc()
          .queryForList(
              SET_SCOPE_SQL,
              role,
              role,
              user.jwt(),
              user.subject(),
              objectMapper.writeValueAsString(user.claims()),
              objectMapper.writeValueAsString(options.headers()),
              options.method(),
              options.path(),
              Objects.requireNonNullElse(options.operation().get(), ""));
    } catch (JsonProcessingException ex) {
      throw new DatabaseException("Failed to serialize request scope tenant_id=" + tenantId(), ex);
    } catch (RuntimeException ex) {
      if (DatabaseErrors.isTimeout(ex)) {
        throw new DatabaseTimeoutException("Setting request scope timed out tenant_id=" + tenantId(), ex);
      }
      throw ex;
    }
  }

  private void prepareExternalPoolTransaction(TenantTransaction transaction) {
    // the pooler can hand back a connection that was already terminated server side
    if (transaction.isCompleted()) {
      transaction.close();
      throw new DatabaseException("Transaction already completed tenant_id=" + tenantId());
    }
    try {
      transaction.jdbc().queryForObject(
          SET_SEARCH_PATH_SQL, String.class, String.join(", ", pool.searchPath()));
    } catch (RuntimeException ex) {
      try {
        transaction.rollback();
      } catch (RuntimeException rollbackError) {
        ex.addSuppressed(rollbackError);
      }
      log.warn("Setting search_path failed tenant_id={} error={}", tenantId(), ex.getMessage());
      throw ex;
    }
  }

  private DatabaseException translate(Exception ex) {
    if (DatabaseErrors.isConnectionLimitError(ex)) {
      return new DatabaseException(
          "Too many connections tenant_id=" + tenantId() + " error=" + DatabaseErrors.errorMessage(ex), ex);
    }
    if (DatabaseErrors.isTimeout(ex)) {
      return new DatabaseTimeoutException("Acquiring connection timed out tenant_id=" + tenantId(), ex);
    }
    return new DatabaseException(
        "Failed to open transaction tenant_id=" + tenantId() + " error=" + DatabaseErrors.errorMessage(ex), ex);
  }
}
