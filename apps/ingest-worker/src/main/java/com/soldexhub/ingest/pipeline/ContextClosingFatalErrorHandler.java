package com.soldexhub.ingest.pipeline;

import com.soldexhub.ingest.IngestionFatalException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Closes the application context with a non-zero exit code. Runs on its own thread because the caller is
 * usually a pipeline thread that the context close will wait for.
 */
public class ContextClosingFatalErrorHandler implements FatalErrorHandler {
  private static final Logger log = LoggerFactory.getLogger(ContextClosingFatalErrorHandler.class);
  static final int EXIT_CODE = 70;

  private final ConfigurableApplicationContext context;

  public ContextClosingFatalErrorHandler(ConfigurableApplicationContext context) {
    this.context = context;
  }

  @Override
  public void onFatal(IngestionFatalException error) {
    Thread closer =
        new Thread(
            () -> {
              log.error("Closing application after fatal ingest error exitCode={}", EXIT_CODE);
              int exitCode = SpringApplication.exit(context, () -> EXIT_CODE);
              System.exit(exitCode);
            },
            "ingest-fatal-shutdown");
    closer.setDaemon(false);
    closer.start();
  }
}
