package com.storagegateway.infra.database.connection;

import com.storagegateway.infra.database.errors.DatabaseException;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

public class TenantTransaction implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TenantTransaction.class);

  private final Connection connection;
  private final Savepoint savepoint;
  private final JdbcTemplate jdbcTemplate;
  private boolean completed;

  private TenantTransaction(Connection connection, Savepoint savepoint) {
    this.connection = Objects.requireNonNull(connection, "connection must not be null");
    this.savepoint = savepoint;
    this.jdbcTemplate = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
  }

  public static TenantTransaction begin(Connection connection) throws SQLException {
    try {
      if (!connection.isClosed()) {
        connection.setAutoCommit(false);
      }
    } catch (SQLException | RuntimeException ex) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        ex.addSuppressed(closeError);
      }
      throw ex;
    }
    return new TenantTransaction(connection, null);
  }

  public TenantTransaction nested() throws SQLException {
    if (isCompleted()) {
      throw new DatabaseException("Transaction already completed");
    }
    return new TenantTransaction(connection, connection.setSavepoint());
  }

  public JdbcTemplate jdbc() {
    return jdbcTemplate;
  }

  public Connection connection() {
    return connection;
  }

  public boolean isNested() {
    return savepoint != null;
  }

  public boolean isCompleted() {
    if (completed) {
      return true;
    }
    try {
      return connection.isClosed();
    } catch (SQLException ex) {
      return true;
    }
  }

  public void commit() {
    if (completed) {
      throw new DatabaseException("Transaction already completed");
    }
    try {
      if (savepoint != null) {
        connection.releaseSavepoint(savepoint);
      } else {
        connection.commit();
      }
    } catch (SQLException ex) {
      throw new DatabaseException("Transaction commit failed", ex);
    } finally {
      complete();
    }
  }

  public void rollback() {
    if (completed) {
      return;
    }
    try {
      if (savepoint != null) {
        connection.rollback(savepoint);
      } else if (!connection.isClosed()) {
        connection.rollback();
      }
    } catch (SQLException ex) {
      throw new DatabaseException("Transaction rollback failed", ex);
    } finally {
      complete();
    }
  }

  @Override
  public void close() {
    if (!completed) {
      rollback();
    }
  }

  private void complete() {
    completed = true;
    if (savepoint != null) {
      return;
    }
    try {
      if (!connection.isClosed()) {
        connection.setAutoCommit(true);
        connection.close();
      }
    } catch (SQLException ex) {
      log.warn("Connection release failed error={}", ex.getMessage());
    }
  }
}
