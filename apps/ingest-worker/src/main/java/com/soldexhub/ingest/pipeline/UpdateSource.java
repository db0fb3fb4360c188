package com.soldexhub.ingest.pipeline;

public enum UpdateSource {
  STREAM,
  BACKFILL
}
