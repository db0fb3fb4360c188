package com.soldexhub.integration.solana;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Doubling backoff capped at a maximum. With jitter enabled the delay is drawn uniformly from
 * {@code [0, deterministic]} so that reconnecting clients spread out.
 */
public class RetryBackoff {
  private final Duration base;
  private final Duration max;
  private final boolean jitter;
  private final DoubleSupplier random;

  public RetryBackoff(Duration base, Duration max, boolean jitter) {
    this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
  }

  public RetryBackoff(Duration base, Duration max, boolean jitter, DoubleSupplier random) {
    Objects.requireNonNull(base, "base must not be null");
    Objects.requireNonNull(max, "max must not be null");
    this.base = base.isNegative() ? Duration.ZERO : base;
    this.max = max.compareTo(this.base) < 0 ? this.base : max;
    this.jitter = jitter;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  /** Delay before retry number {@code attempt}, counting from 1. */
  public Duration delayForAttempt(int attempt) {
    Duration deterministic = capped(attempt);
    if (!jitter || deterministic.isZero()) {
      return deterministic;
    }
    double factor = Math.max(0.0d, Math.min(1.0d, random.getAsDouble()));
    return Duration.ofMillis((long) Math.floor(deterministic.toMillis() * factor));
  }

  public Duration max() {
    return max;
  }

  private Duration capped(int attempt) {
    Duration value = base;
    for (int step = 1; step < attempt; step++) {
      if (value.compareTo(max.dividedBy(2)) >= 0) {
        return max;
      }
      value = value.multipliedBy(2);
    }
    return value.compareTo(max) > 0 ? max : value;
  }
}
