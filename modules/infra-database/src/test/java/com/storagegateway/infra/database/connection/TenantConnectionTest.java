package com.storagegateway.infra.database.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storagegateway.infra.database.errors.DatabaseErrors;
import com.storagegateway.infra.database.errors.DatabaseException;
import com.storagegateway.infra.database.errors.DatabaseTimeoutException;
import com.storagegateway.infra.database.pool.TenantPool;
import com.storagegateway.infra.database.retry.ExponentialBackoff;
import com.storagegateway.infra.database.retry.RetryExecutor;
import com.storagegateway.infra.database.retry.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenantConnectionTest {
  private static final DatabaseUser USER =
      new DatabaseUser("user-jwt", Map.of("role", "authenticated", "sub", "user-1"));
  private static final DatabaseUser SERVICE = DatabaseUser.serviceRole("service-jwt");

  @Mock private TenantPool pool;
  @Mock private DataSource dataSource;
  @Mock private Connection connection;

  private RetryExecutor retryExecutor;

  @BeforeEach
  void setUp() {
    RetryPolicy policy =
        new RetryPolicy(
            Duration.ofMillis(50L),
            Duration.ofMillis(200L),
            Duration.ofSeconds(3),
            10,
            DatabaseErrors::isConnectionLimitError);
    retryExecutor =
        new RetryExecutor(
            "tenant_transaction",
            policy,
            new ExponentialBackoff(50L, 200L),
            duration -> {},
            Clock.systemUTC(),
            new SimpleMeterRegistry());
  }

  @Test
  void shouldRetryWhenServerRejectsForTooManyConnections() throws Exception {
    when(pool.dataSource()).thenReturn(dataSource);
    when(dataSource.getConnection())
        .thenThrow(new SQLException("sorry, too many clients already", "53300"))
        .thenThrow(new SQLException("no more connections allowed (max_client_conn)", "08P01"))
        .thenReturn(connection);

    TenantTransaction transaction = connection().transaction();

    assertFalse(transaction.isCompleted());
    verify(dataSource, times(3)).getConnection();
    verify(connection).setAutoCommit(false);
  }

  @Test
  void shouldNotRetryOtherConnectionErrors() throws Exception {
    when(pool.dataSource()).thenReturn(dataSource);
    when(dataSource.getConnection())
        .thenThrow(new SQLException("password authentication failed", "28P01"));

    DatabaseException thrown = assertThrows(DatabaseException.class, () -> connection().transaction());

    assertFalse(thrown instanceof DatabaseTimeoutException);
    assertInstanceOf(SQLException.class, thrown.getCause());
    verify(dataSource, times(1)).getConnection();
  }

  @Test
  void shouldCloseConnectionWhenTransactionCannotBegin() throws Exception {
    when(pool.dataSource()).thenReturn(dataSource);
    when(dataSource.getConnection()).thenReturn(connection);
    doThrow(new SQLException("connection reset", "08006")).when(connection).setAutoCommit(false);

    DatabaseException thrown = assertThrows(DatabaseException.class, () -> connection().transaction());

    assertInstanceOf(SQLException.class, thrown.getCause());
    verify(connection).close();
  }

  @Test
  void shouldReportAcquireTimeoutAsDatabaseTimeout() throws Exception {
    when(pool.dataSource()).thenReturn(dataSource);
    when(dataSource.getConnection())
        .thenThrow(
            new SQLTransientConnectionException(
                "tenant-pool-1 - Connection is not available, request timed out after 3000ms."));

    assertThrows(DatabaseTimeoutException.class, () -> connection().transaction());
  }

  @Test
  void shouldRejectAlreadyCompletedTransactionFromExternalPool() throws Exception {
    when(pool.dataSource()).thenReturn(dataSource);
    when(pool.isExternal()).thenReturn(true);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.isClosed()).thenReturn(true);

    DatabaseException thrown = assertThrows(DatabaseException.class, () -> connection().transaction());

    assertTrue(thrown.getMessage().startsWith("Transaction already completed"));
  }

  @Test
  void shouldDefaultToAnonRole() {
    assertEquals("anon", new DatabaseUser("", Map.of()).role());
  }

  private TenantConnection connection() {
    return new TenantConnection(
        pool,
        TenantConnectionOptions.of("tenant-a", "postgres://db/postgres", USER, SERVICE),
        retryExecutor,
        new ObjectMapper());
  }
}
