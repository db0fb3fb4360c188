package com.soldexhub.ingest.stream;

import java.util.Locale;

public enum BackfillTrigger {
  STARTUP,
  RECONNECT;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
