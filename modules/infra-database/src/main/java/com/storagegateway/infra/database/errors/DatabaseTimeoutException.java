package com.storagegateway.infra.database.errors;

public class DatabaseTimeoutException extends DatabaseException {
  public DatabaseTimeoutException(String message, Throwable cause) {
    super(message, cause);
  }
}
