package com.storagegateway.infra.queue.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingQueueErrorListener implements QueueErrorListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingQueueErrorListener.class);

  @Override
  public void onError(String queue, Throwable error) {
    log.debug(
        "Queue worker error queue={} error_type={} error={}",
        queue,
        error.getClass().getSimpleName(),
        error.getMessage());
  }
}
