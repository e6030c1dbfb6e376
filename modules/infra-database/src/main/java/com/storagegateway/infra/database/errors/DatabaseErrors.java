package com.storagegateway.infra.database.errors;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.TimeoutException;
import org.springframework.dao.QueryTimeoutException;

public final class DatabaseErrors {
  private static final String TOO_MANY_CONNECTIONS = "53300";
  private static final String PROTOCOL_VIOLATION = "08P01";

  private DatabaseErrors() {}

  /** Connection limit reached on the server or on a pooler in front of it. */
  public static boolean isConnectionLimitError(Throwable error) {
    Throwable current = error;
    while (current != null) {
      String message = current.getMessage() == null ? "" : current.getMessage();
      if (current instanceof SQLException sql) {
        if (TOO_MANY_CONNECTIONS.equals(sql.getSQLState())) {
          return true;
        }
        if (PROTOCOL_VIOLATION.equals(sql.getSQLState())
            && message.contains("no more connections allowed")) {
          return true;
        }
      }
      if (message.contains("Max client connections reached")) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  public static boolean isTimeout(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof SQLTimeoutException
          || current instanceof SQLTransientConnectionException
          || current instanceof QueryTimeoutException
          || current instanceof TimeoutException) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  public static String errorMessage(Throwable ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return message;
  }
}
