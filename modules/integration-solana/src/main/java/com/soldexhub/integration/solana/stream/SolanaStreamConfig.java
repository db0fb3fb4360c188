package com.soldexhub.integration.solana.stream;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

public record SolanaStreamConfig(
    URI wsUri,
    List<String> programIds,
    String commitment,
    Duration connectTimeout,
    Duration pingInterval,
    Duration reconnectBaseBackoff,
    Duration reconnectMaxBackoff,
    Duration stableConnectionReset,
    int maxConsecutiveFailures,
    Clock clock) {
  public SolanaStreamConfig {
    if (wsUri == null) {
      throw new IllegalArgumentException("wsUri is required");
    }
    if (programIds == null || programIds.isEmpty()) {
      throw new IllegalArgumentException("programIds must not be empty");
    }
    programIds = List.copyOf(programIds);
    if (commitment == null || commitment.isBlank()) {
      throw new IllegalArgumentException("commitment is required");
    }
    requirePositive(connectTimeout, "connectTimeout");
    requirePositive(pingInterval, "pingInterval");
    requirePositive(reconnectBaseBackoff, "reconnectBaseBackoff");
    requirePositive(reconnectMaxBackoff, "reconnectMaxBackoff");
    if (reconnectMaxBackoff.compareTo(reconnectBaseBackoff) < 0) {
      throw new IllegalArgumentException("reconnectMaxBackoff must be >= reconnectBaseBackoff");
    }
    requirePositive(stableConnectionReset, "stableConnectionReset");
    if (maxConsecutiveFailures <= 0) {
      throw new IllegalArgumentException("maxConsecutiveFailures must be > 0");
    }
    if (clock == null) {
      throw new IllegalArgumentException("clock is required");
    }
  }

  private static void requirePositive(Duration value, String name) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }
}
