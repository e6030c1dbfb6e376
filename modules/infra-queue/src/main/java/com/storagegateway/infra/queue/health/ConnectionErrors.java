package com.storagegateway.infra.queue.health;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

public final class ConnectionErrors {
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private ConnectionErrors() {}

  /** Refused, timed out or dropped connections, anywhere in the cause chain. */
  public static boolean isConnectionError(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof ConnectException
          || current instanceof NoRouteToHostException
          || current instanceof SocketTimeoutException
          || current instanceof SQLTransientConnectionException
          || current instanceof CannotGetJdbcConnectionException) {
        return true;
      }
      if (current instanceof SQLException sql
          && sql.getSQLState() != null
          && sql.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS)) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }
}
