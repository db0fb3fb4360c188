package com.soldexhub.integration.solana.stream;

import java.util.List;
import java.util.Objects;

/** One {@code logsNotification}: a transaction that mentioned a subscribed program. */
public record LogsNotification(
    String programId, String signature, long slot, List<String> logs, boolean failed) {
  public LogsNotification {
    Objects.requireNonNull(programId, "programId must not be null");
    Objects.requireNonNull(signature, "signature must not be null");
    logs = logs == null ? List.of() : List.copyOf(logs);
  }
}
