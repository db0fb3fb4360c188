package com.soldexhub.ingest;

/** The pipeline cannot make progress without an operator: the store or the upstream is persistently down. */
public class IngestionFatalException extends RuntimeException {
  public IngestionFatalException(String message) {
    super(message);
  }

  public IngestionFatalException(String message, Throwable cause) {
    super(message, cause);
  }
}
