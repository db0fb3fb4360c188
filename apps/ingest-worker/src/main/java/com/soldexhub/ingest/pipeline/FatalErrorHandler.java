package com.soldexhub.ingest.pipeline;

import com.soldexhub.ingest.IngestionFatalException;

@FunctionalInterface
public interface FatalErrorHandler {
  void onFatal(IngestionFatalException error);
}
