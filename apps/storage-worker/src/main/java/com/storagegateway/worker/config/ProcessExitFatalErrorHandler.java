package com.storagegateway.worker.config;

import com.storagegateway.infra.queue.health.FatalErrorHandler;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/** Closes the application context and exits non-zero so the orchestrator restarts the worker. */
public class ProcessExitFatalErrorHandler implements FatalErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(ProcessExitFatalErrorHandler.class);

  private final ConfigurableApplicationContext context;
  private final IntConsumer exitHook;

  public ProcessExitFatalErrorHandler(ConfigurableApplicationContext context) {
    this(context, System::exit);
  }

  ProcessExitFatalErrorHandler(ConfigurableApplicationContext context, IntConsumer exitHook) {
    this.context = context;
    this.exitHook = exitHook;
  }

  @Override
  public void onFatalError(Throwable error) {
    log.error("Queue unhealthy, exiting worker error={}", error.getMessage(), error);
    int exitCode = SpringApplication.exit(context, () -> 1);
    exitHook.accept(exitCode);
  }
}
