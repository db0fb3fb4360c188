package com.soldexhub.ingest.pool;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.MetadataUnresolvableException;
import com.soldexhub.domain.trades.NativeMint;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.trade.PersistenceWriter;
import com.soldexhub.ingest.trade.TradeRepository;
import com.soldexhub.integration.solana.accounts.PoolMetadataFetcher;
import com.soldexhub.integration.solana.rpc.SolanaRpcException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class PoolRegistryTest {
  private static final String POOL = "58oQChx4yWmvKdwLLZzBi4ChoCc2fqCUWBkwMihLYQo2";
  private static final String TOKEN = "4k3Dyjzvzp8eMZWUXbBCjEvwSkkk59S5iCNLY3QrkX6R";

  private final InMemoryPoolRepository repository = new InMemoryPoolRepository();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
  private final List<PoolMetadata> registered = new CopyOnWriteArrayList<>();
  private final ExecutorService callers = Executors.newFixedThreadPool(8);
  private PoolRegistry registry;

  @AfterEach
  void tearDown() {
    callers.shutdownNow();
    if (registry != null) {
      registry.close();
    }
  }

  @Test
  void shouldFetchAndInsertOnceForConcurrentFirstSight() throws Exception {
    CountDownLatch fetchStarted = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger fetches = new AtomicInteger();
    registry =
        newRegistry(
            address -> {
              fetches.incrementAndGet();
              fetchStarted.countDown();
              await(release);
              return raydiumPool();
            },
            Duration.ofSeconds(5));

    List<Future<PoolMetadata>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      Callable<PoolMetadata> call = () -> registry.resolve(POOL, null);
      results.add(callers.submit(call));
    }
    assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));
    Thread.sleep(100L);
    release.countDown();

    for (Future<PoolMetadata> result : results) {
      assertEquals(raydiumPool(), result.get(5, TimeUnit.SECONDS));
    }
    assertEquals(1, fetches.get());
    assertEquals(1, repository.insertAttempts.get());
    assertEquals(List.of(raydiumPool()), registered);
    assertEquals(1.0d, meterRegistry.get("ingest.pool.fetch.total").tag("outcome", "fetched").counter().count());
  }

  @Test
  void shouldSurfaceTimeoutAsUnresolvableAndStillPopulateCache() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    registry =
        newRegistry(
            address -> {
              await(release);
              return raydiumPool();
            },
            Duration.ofMillis(50));

    MetadataUnresolvableException error =
        assertThrows(MetadataUnresolvableException.class, () -> registry.resolve(POOL, null));

    assertEquals(POOL, error.poolAddress());
    assertEquals(1.0d, meterRegistry.get("ingest.pool.fetch.total").tag("outcome", "timeout").counter().count());

    release.countDown();
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (registry.cached(POOL).isEmpty() && System.nanoTime() < deadline) {
      Thread.sleep(10L);
    }
    assertEquals(raydiumPool(), registry.cached(POOL).orElseThrow());
  }

  @Test
  void shouldRememberUnresolvableAddressesUntilTtlExpires() {
    AtomicInteger fetches = new AtomicInteger();
    registry =
        newRegistry(
            address -> {
              fetches.incrementAndGet();
              throw new MetadataUnresolvableException(address, "Account owner is not a supported pool program");
            },
            Duration.ofSeconds(5));

    assertThrows(MetadataUnresolvableException.class, () -> registry.resolve(POOL, null));
    assertThrows(MetadataUnresolvableException.class, () -> registry.resolve(POOL, null));
    assertEquals(1, fetches.get());
    assertEquals(
        1.0d, meterRegistry.get("ingest.pool.fetch.total").tag("outcome", "negative_cached").counter().count());

    clock.advance(Duration.ofMinutes(11));

    assertThrows(MetadataUnresolvableException.class, () -> registry.resolve(POOL, null));
    assertEquals(2, fetches.get());
  }

  @Test
  void shouldNotRememberTransientFetchFailures() {
    AtomicInteger fetches = new AtomicInteger();
    registry =
        newRegistry(
            address -> {
              fetches.incrementAndGet();
              throw new SolanaRpcException("HTTP 503", 503, null);
            },
            Duration.ofSeconds(5));

    assertThrows(PoolFetchException.class, () -> registry.resolve(POOL, null));
    assertThrows(PoolFetchException.class, () -> registry.resolve(POOL, null));

    assertEquals(2, fetches.get());
  }

  @Test
  void shouldUseHintWithoutFetching() {
    AtomicInteger fetches = new AtomicInteger();
    registry = newRegistry(address -> {
      fetches.incrementAndGet();
      return raydiumPool();
    }, Duration.ofSeconds(5));

    PoolMetadata resolved = registry.resolve(POOL, raydiumPool());

    assertEquals(raydiumPool(), resolved);
    assertEquals(0, fetches.get());
    assertEquals(raydiumPool(), repository.rows.get(POOL));
    assertEquals(List.of(raydiumPool()), registered);
    assertSame(resolved, registry.resolve(POOL, null));
  }

  @Test
  void shouldPreferStoredRowOverFetch() {
    repository.rows.put(POOL, raydiumPool());
    AtomicInteger fetches = new AtomicInteger();
    registry = newRegistry(address -> {
      fetches.incrementAndGet();
      return raydiumPool();
    }, Duration.ofSeconds(5));

    assertEquals(raydiumPool(), registry.resolve(POOL, null));

    assertEquals(0, fetches.get());
    assertEquals(0, repository.insertAttempts.get());
    assertTrue(registered.isEmpty());
  }

  @Test
  void shouldRetryStoreReadBeforeFetching() {
    repository.rows.put(POOL, raydiumPool());
    repository.failingReads.set(1);
    AtomicInteger fetches = new AtomicInteger();
    registry = newRegistry(address -> {
      fetches.incrementAndGet();
      return raydiumPool();
    }, Duration.ofSeconds(5), 2);

    assertEquals(raydiumPool(), registry.resolve(POOL, null));

    assertEquals(2, repository.reads.get());
    assertEquals(0, fetches.get());
    assertEquals(1.0d, meterRegistry.get("ingest.pool.fetch.total").tag("outcome", "store").counter().count());
  }

  @Test
  void shouldRaiseFatalWhenStoreReadsKeepFailing() {
    repository.failingReads.set(10);
    registry = newRegistry(address -> {
      throw new AssertionError("fetch not expected");
    }, Duration.ofSeconds(5), 2);

    assertThrows(IngestionFatalException.class, () -> registry.resolve(POOL, null));
    assertEquals(2, repository.reads.get());
  }

  @Test
  void shouldNotAnnouncePoolsWithoutSolSide() {
    registry = newRegistry(address -> {
      throw new AssertionError("fetch not expected");
    }, Duration.ofSeconds(5));
    PoolMetadata tokenPair =
        new PoolMetadata(POOL, DexKind.METEORA_DLMM, TOKEN, "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", 6, 6);

    registry.register(tokenPair);

    assertEquals(tokenPair, repository.rows.get(POOL));
    assertTrue(registered.isEmpty());
  }

  @Test
  void shouldClearUnresolvableVerdictWhenPoolIsAnnounced() {
    registry =
        newRegistry(
            address -> {
              throw new MetadataUnresolvableException(address, "Pool account not found");
            },
            Duration.ofSeconds(5));
    assertThrows(MetadataUnresolvableException.class, () -> registry.resolve(POOL, null));

    registry.register(raydiumPool());

    assertEquals(raydiumPool(), registry.resolve(POOL, null));
  }

  @Test
  void shouldWarmUpFromStore() {
    repository.insertIfAbsent(raydiumPool());
    registry = newRegistry(address -> {
      throw new AssertionError("fetch not expected");
    }, Duration.ofSeconds(5));

    assertEquals(1, registry.warmUp(10));
    assertEquals(raydiumPool(), registry.resolve(POOL, null));
    assertEquals(1, registry.size());
  }

  private PoolRegistry newRegistry(PoolMetadataFetcher fetcher, Duration fetchTimeout) {
    return newRegistry(fetcher, fetchTimeout, 1);
  }

  private PoolRegistry newRegistry(PoolMetadataFetcher fetcher, Duration fetchTimeout, int storeAttempts) {
    PersistenceWriter writer =
        new PersistenceWriter(
            mock(TradeRepository.class),
            repository,
            storeAttempts,
            Duration.ZERO,
            Duration.ZERO,
            meterRegistry);
    return new PoolRegistry(
        fetcher,
        repository,
        writer,
        Executors.newFixedThreadPool(2),
        fetchTimeout,
        Duration.ofMinutes(10),
        meterRegistry,
        clock,
        registered::add);
  }

  private static PoolMetadata raydiumPool() {
    return new PoolMetadata(POOL, DexKind.RAYDIUM_AMM, TOKEN, NativeMint.ADDRESS, 6, 9);
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(10, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  static final class MutableClock extends Clock {
    private volatile Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
