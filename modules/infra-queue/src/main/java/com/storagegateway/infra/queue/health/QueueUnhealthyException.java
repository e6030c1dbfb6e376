package com.storagegateway.infra.queue.health;

public class QueueUnhealthyException extends RuntimeException {
  public QueueUnhealthyException(String message) {
    super(message);
  }
}
