package com.soldexhub.integration.solana.rpc;

import com.soldexhub.integration.solana.RetryBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Objects;

/** Re-runs an RPC call while it fails with a retryable {@link SolanaRpcException}. */
public class RpcRetryExecutor {
  private static final String RETRY_COUNTER = "solana.rpc.retry.total";
  private static final String EXHAUSTED_COUNTER = "solana.rpc.exhausted.total";

  private final int maxAttempts;
  private final RetryBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;

  public RpcRetryExecutor(int maxAttempts, RetryBackoff backoff, MeterRegistry meterRegistry) {
    this(maxAttempts, backoff, duration -> Thread.sleep(duration.toMillis()), meterRegistry);
  }

  public RpcRetryExecutor(
      int maxAttempts, RetryBackoff backoff, Sleeper sleeper, MeterRegistry meterRegistry) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public <T> T execute(String method, Operation<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.run();
      } catch (SolanaRpcException ex) {
        if (!ex.isRetryable()) {
          throw ex;
        }
        if (attempt >= maxAttempts) {
          meterRegistry.counter(EXHAUSTED_COUNTER, "method", method).increment();
          throw ex;
        }
        meterRegistry.counter(RETRY_COUNTER, "method", method).increment();
        sleep(backoff.delayForAttempt(attempt));
        attempt++;
      }
    }
  }

  private void sleep(Duration duration) {
    if (duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new SolanaRpcException("Interrupted during RPC retry backoff", -1, null, interrupted);
    }
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
