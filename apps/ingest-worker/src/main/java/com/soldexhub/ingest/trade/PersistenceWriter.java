package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.pool.PoolRepository;
import com.soldexhub.integration.solana.RetryBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Commits trade batches and pool rows. Store errors, including a transaction that cannot be opened, are
 * retried with capped backoff; when the attempts run out the writer raises {@link IngestionFatalException}
 * instead of dropping data. Pool lookups made on the write path go through the same policy.
 */
public class PersistenceWriter {
  private static final Logger log = LoggerFactory.getLogger(PersistenceWriter.class);
  private static final String BATCH_COUNTER = "ingest.writer.batch.total";
  private static final String READ_COUNTER = "ingest.writer.read.total";

  private final TradeRepository tradeRepository;
  private final PoolRepository poolRepository;
  private final int maxAttempts;
  private final RetryBackoff backoff;
  private final Sleeper sleeper;
  private final MeterRegistry meterRegistry;
  private final Timer batchTimer;

  public PersistenceWriter(
      TradeRepository tradeRepository,
      PoolRepository poolRepository,
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      MeterRegistry meterRegistry) {
    this(
        tradeRepository,
        poolRepository,
        maxAttempts,
        new RetryBackoff(initialBackoff, maxBackoff, false),
        duration -> Thread.sleep(duration.toMillis()),
        meterRegistry);
  }

  PersistenceWriter(
      TradeRepository tradeRepository,
      PoolRepository poolRepository,
      int maxAttempts,
      RetryBackoff backoff,
      Sleeper sleeper,
      MeterRegistry meterRegistry) {
    this.tradeRepository = Objects.requireNonNull(tradeRepository, "tradeRepository must not be null");
    this.poolRepository = Objects.requireNonNull(poolRepository, "poolRepository must not be null");
    this.maxAttempts = Math.max(1, maxAttempts);
    this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.batchTimer = meterRegistry.timer("ingest.writer.batch.duration");
  }

  /** Writes one batch in a single transaction. Existing keys are skipped and reported as duplicates. */
  public WriteResult writeTrades(List<Trade> batch) {
    if (batch.isEmpty()) {
      return new WriteResult(0, List.of());
    }
    long started = System.nanoTime();
    List<Trade> inserted =
        withRetry("trades", BATCH_COUNTER, () -> tradeRepository.insertIgnoringConflicts(batch));
    batchTimer.record(Duration.ofNanos(System.nanoTime() - started));
    WriteResult result = new WriteResult(batch.size(), inserted);
    meterRegistry.counter(BATCH_COUNTER, "outcome", "committed").increment();
    meterRegistry.counter("ingest.writer.trades.total", "outcome", "inserted").increment(result.inserted());
    meterRegistry.counter("ingest.writer.trades.total", "outcome", "duplicate").increment(result.duplicates());
    log.info(
        "Trade batch committed attempted={} inserted={} duplicates={}",
        result.attempted(),
        result.inserted(),
        result.duplicates());
    return result;
  }

  /** @return {@code true} if the row was new */
  public boolean writePool(PoolMetadata pool) {
    return withRetry("pools", BATCH_COUNTER, () -> poolRepository.insertIfAbsent(pool));
  }

  public Optional<PoolMetadata> findPool(String address) {
    return withRetry("pools", READ_COUNTER, () -> poolRepository.findByAddress(address));
  }

  private <T> T withRetry(String target, String counter, Supplier<T> operation) {
    int attempt = 1;
    while (true) {
      try {
        return operation.get();
      } catch (DataAccessException | TransactionException ex) {
        if (attempt >= maxAttempts) {
          meterRegistry.counter(counter, "outcome", "exhausted").increment();
          log.error("Store access exhausted target={} attempts={}", target, attempt, ex);
          throw new IngestionFatalException(
              "Store access to " + target + " failed after " + attempt + " attempts", ex);
        }
        Duration delay = backoff.delayForAttempt(attempt);
        meterRegistry.counter(counter, "outcome", "retried").increment();
        log.warn(
            "Store access failed target={} attempt={} retryInMs={} error={}",
            target,
            attempt,
            delay.toMillis(),
            ex.getClass().getSimpleName());
        sleep(delay);
        attempt++;
      }
    }
  }

  private void sleep(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IngestionFatalException("Interrupted while backing off store access", interrupted);
    }
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
