package com.soldexhub.ingest.trade;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.pool.PoolRepository;
import com.soldexhub.integration.solana.RetryBackoff;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

class PersistenceWriterTest {
  private final TradeRepository tradeRepository = mock(TradeRepository.class);
  private final PoolRepository poolRepository = mock(PoolRepository.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final List<Duration> sleeps = new ArrayList<>();
  private final PersistenceWriter writer =
      new PersistenceWriter(
          tradeRepository,
          poolRepository,
          3,
          new RetryBackoff(Duration.ofMillis(100), Duration.ofMillis(150), false),
          sleeps::add,
          meterRegistry);

  @Test
  void shouldReportInsertedAndDuplicateCounts() {
    Trade first = TradeSequencerTest.trade("sig-a", 0, 10L, "trader");
    Trade second = TradeSequencerTest.trade("sig-b", 0, 10L, "trader");
    when(tradeRepository.insertIgnoringConflicts(List.of(first, second))).thenReturn(List.of(second));

    WriteResult result = writer.writeTrades(List.of(first, second));

    assertEquals(2, result.attempted());
    assertEquals(1, result.inserted());
    assertEquals(1, result.duplicates());
    assertEquals(List.of(second), result.insertedTrades());
    assertEquals(1.0d, meterRegistry.get("ingest.writer.trades.total").tag("outcome", "inserted").counter().count());
    assertEquals(1.0d, meterRegistry.get("ingest.writer.trades.total").tag("outcome", "duplicate").counter().count());
    assertEquals(1L, meterRegistry.get("ingest.writer.batch.duration").timer().count());
  }

  @Test
  void shouldRetryTransientStoreFailures() {
    Trade trade = TradeSequencerTest.trade("sig-a", 0, 10L, "trader");
    when(tradeRepository.insertIgnoringConflicts(anyList()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"))
        .thenReturn(List.of(trade));

    WriteResult result = writer.writeTrades(List.of(trade));

    assertEquals(1, result.inserted());
    assertEquals(List.of(Duration.ofMillis(100)), sleeps);
    assertEquals(1.0d, meterRegistry.get("ingest.writer.batch.total").tag("outcome", "retried").counter().count());
  }

  @Test
  void shouldRaiseFatalAfterMaxAttempts() {
    when(tradeRepository.insertIgnoringConflicts(anyList()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    IngestionFatalException error =
        assertThrows(
            IngestionFatalException.class,
            () -> writer.writeTrades(List.of(TradeSequencerTest.trade("sig-a", 0, 10L, "trader"))));

    assertInstanceOf(DataAccessResourceFailureException.class, error.getCause());
    verify(tradeRepository, times(3)).insertIgnoringConflicts(anyList());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(150)), sleeps);
    assertEquals(1.0d, meterRegistry.get("ingest.writer.batch.total").tag("outcome", "exhausted").counter().count());
  }

  @Test
  void shouldRetryWhenTransactionCannotBeOpened() {
    Trade trade = TradeSequencerTest.trade("sig-a", 0, 10L, "trader");
    when(tradeRepository.insertIgnoringConflicts(anyList()))
        .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection for transaction"))
        .thenReturn(List.of(trade));

    WriteResult result = writer.writeTrades(List.of(trade));

    assertEquals(1, result.inserted());
    assertEquals(List.of(Duration.ofMillis(100)), sleeps);
  }

  @Test
  void shouldRaiseFatalWhenTransactionsNeverOpen() {
    when(tradeRepository.insertIgnoringConflicts(anyList()))
        .thenThrow(new CannotCreateTransactionException("Could not open JDBC Connection for transaction"));

    IngestionFatalException error =
        assertThrows(
            IngestionFatalException.class,
            () -> writer.writeTrades(List.of(TradeSequencerTest.trade("sig-a", 0, 10L, "trader"))));

    assertInstanceOf(CannotCreateTransactionException.class, error.getCause());
    verify(tradeRepository, times(3)).insertIgnoringConflicts(anyList());
  }

  @Test
  void shouldRetryPoolReads() {
    PoolMetadata pool = pumpAmmPool();
    when(poolRepository.findByAddress(pool.address()))
        .thenThrow(new DataAccessResourceFailureException("connection reset"))
        .thenReturn(Optional.of(pool));

    assertEquals(Optional.of(pool), writer.findPool(pool.address()));
    assertEquals(List.of(Duration.ofMillis(100)), sleeps);
    assertEquals(1.0d, meterRegistry.get("ingest.writer.read.total").tag("outcome", "retried").counter().count());
  }

  @Test
  void shouldBackOffWithDefaultSleeper() {
    PersistenceWriter defaultWriter =
        new PersistenceWriter(
            tradeRepository, poolRepository, 2, Duration.ofMillis(20), Duration.ofMillis(20), meterRegistry);
    Trade trade = TradeSequencerTest.trade("sig-a", 0, 10L, "trader");
    when(tradeRepository.insertIgnoringConflicts(anyList()))
        .thenThrow(new DataAccessResourceFailureException("connection refused"))
        .thenReturn(List.of(trade));

    long started = System.nanoTime();
    WriteResult result = defaultWriter.writeTrades(List.of(trade));

    assertEquals(1, result.inserted());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() >= 20L);
  }

  @Test
  void shouldNotTouchStoreForEmptyBatch() {
    WriteResult result = writer.writeTrades(List.of());

    assertEquals(0, result.attempted());
    verify(tradeRepository, times(0)).insertIgnoringConflicts(anyList());
  }

  @Test
  void shouldWritePoolRows() {
    PoolMetadata pool = pumpAmmPool();
    when(poolRepository.insertIfAbsent(pool)).thenReturn(true, false);

    assertTrue(writer.writePool(pool));
    assertFalse(writer.writePool(pool));
  }

  private static PoolMetadata pumpAmmPool() {
    return new PoolMetadata(
        "Pool111111111111111111111111111111111111111",
        DexKind.PUMP_AMM,
        "TokenMint1111111111111111111111111111111111",
        "So11111111111111111111111111111111111111112",
        6,
        9);
  }
}
