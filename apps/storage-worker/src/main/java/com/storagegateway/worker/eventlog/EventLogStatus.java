package com.storagegateway.worker.eventlog;

public enum EventLogStatus {
  PENDING,
  SIGNATURE_INVALID
}
