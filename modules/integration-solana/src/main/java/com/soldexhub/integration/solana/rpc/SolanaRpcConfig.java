package com.soldexhub.integration.solana.rpc;

import java.net.URI;
import java.time.Duration;

public record SolanaRpcConfig(
    URI endpoint,
    String commitment,
    Duration timeout,
    int maxAttempts,
    Duration retryBaseBackoff,
    Duration retryMaxBackoff) {
  public SolanaRpcConfig {
    if (endpoint == null) {
      throw new IllegalArgumentException("endpoint is required");
    }
    if (commitment == null || commitment.isBlank()) {
      throw new IllegalArgumentException("commitment is required");
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (retryBaseBackoff == null || retryBaseBackoff.isNegative()) {
      throw new IllegalArgumentException("retryBaseBackoff must be >= 0");
    }
    if (retryMaxBackoff == null || retryMaxBackoff.compareTo(retryBaseBackoff) < 0) {
      throw new IllegalArgumentException("retryMaxBackoff must be >= retryBaseBackoff");
    }
  }
}
