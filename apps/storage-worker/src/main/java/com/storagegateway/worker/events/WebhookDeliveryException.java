package com.storagegateway.worker.events;

public class WebhookDeliveryException extends RuntimeException {
  private final int statusCode;

  public WebhookDeliveryException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public WebhookDeliveryException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
