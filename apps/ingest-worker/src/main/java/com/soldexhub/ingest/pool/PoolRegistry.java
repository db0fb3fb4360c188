package com.soldexhub.ingest.pool;

import com.soldexhub.domain.trades.MetadataUnresolvableException;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.trade.PersistenceWriter;
import com.soldexhub.integration.solana.accounts.PoolMetadataFetcher;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Address to {@link PoolMetadata} memo shared by all lanes.
 *
 * <p>Concurrent first lookups of the same address join one in-flight future, so an unseen pool costs one
 * fetch and one {@code pools} insert. The row is written before the cache entry becomes visible, and the
 * in-flight entry is removed only after that, so a later caller either hits the cache or joins the fetch.
 * Callers wait at most {@code fetchTimeout}; the fetch itself keeps running and still populates the cache.
 */
public class PoolRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);
  private static final String FETCH_COUNTER = "ingest.pool.fetch.total";

  private final PoolMetadataFetcher fetcher;
  private final PoolRepository repository;
  private final PersistenceWriter writer;
  private final ExecutorService fetchExecutor;
  private final Duration fetchTimeout;
  private final Duration negativeTtl;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final PoolRegistrationListener listener;
  private final ConcurrentHashMap<String, PoolMetadata> pools = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, CompletableFuture<PoolMetadata>> inFlight =
      new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Instant> unresolvableUntil = new ConcurrentHashMap<>();

  public PoolRegistry(
      PoolMetadataFetcher fetcher,
      PoolRepository repository,
      PersistenceWriter writer,
      int fetchConcurrency,
      Duration fetchTimeout,
      Duration negativeTtl,
      MeterRegistry meterRegistry,
      PoolRegistrationListener listener) {
    this(
        fetcher,
        repository,
        writer,
        newFetchExecutor(fetchConcurrency),
        fetchTimeout,
        negativeTtl,
        meterRegistry,
        Clock.systemUTC(),
        listener);
  }

  PoolRegistry(
      PoolMetadataFetcher fetcher,
      PoolRepository repository,
      PersistenceWriter writer,
      ExecutorService fetchExecutor,
      Duration fetchTimeout,
      Duration negativeTtl,
      MeterRegistry meterRegistry,
      Clock clock,
      PoolRegistrationListener listener) {
    this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
    this.repository = Objects.requireNonNull(repository, "repository must not be null");
    this.writer = Objects.requireNonNull(writer, "writer must not be null");
    this.fetchExecutor = Objects.requireNonNull(fetchExecutor, "fetchExecutor must not be null");
    this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout must not be null");
    this.negativeTtl = Objects.requireNonNull(negativeTtl, "negativeTtl must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.listener = listener == null ? PoolRegistrationListener.noop() : listener;
  }

  /**
   * Returns the metadata for {@code address}, fetching it on first sight.
   *
   * @param hint metadata read from the same transaction, or {@code null}
   * @throws MetadataUnresolvableException if the address is not a supported pool, was recently found not to
   *     be one, or the lookup timed out
   * @throws PoolFetchException if the lookup failed for a transient reason
   * @throws IngestionFatalException if the pool row could not be read or stored
   */
  public PoolMetadata resolve(String address, PoolMetadata hint) {
    PoolMetadata cached = pools.get(address);
    if (cached != null) {
      return cached;
    }
    if (hint == null) {
      rejectIfRecentlyUnresolvable(address);
    }
    CompletableFuture<PoolMetadata> mine = new CompletableFuture<>();
    CompletableFuture<PoolMetadata> existing = inFlight.putIfAbsent(address, mine);
    if (existing != null) {
      return await(address, existing);
    }
    PoolMetadata again = pools.get(address);
    if (again != null) {
      inFlight.remove(address, mine);
      mine.complete(again);
      return again;
    }
    try {
      fetchExecutor.execute(() -> load(address, hint, mine));
    } catch (RejectedExecutionException ex) {
      inFlight.remove(address, mine);
      mine.completeExceptionally(ex);
    }
    return await(address, mine);
  }

  /** Registers a pool announced by a pool-created event. Clears any earlier unresolvable verdict. */
  public PoolMetadata register(PoolMetadata pool) {
    Objects.requireNonNull(pool, "pool must not be null");
    unresolvableUntil.remove(pool.address());
    return resolve(pool.address(), pool);
  }

  public Optional<PoolMetadata> cached(String address) {
    return Optional.ofNullable(pools.get(address));
  }

  public int size() {
    return pools.size();
  }

  /** Loads already stored pools into the cache. */
  public int warmUp(int limit) {
    if (limit <= 0) {
      return 0;
    }
    List<PoolMetadata> stored = repository.findRecent(limit);
    int loaded = 0;
    for (PoolMetadata pool : stored) {
      if (pools.putIfAbsent(pool.address(), pool) == null) {
        loaded++;
      }
    }
    log.info("Pool registry warmed up loaded={} limit={}", loaded, limit);
    return loaded;
  }

  @Override
  public void close() {
    fetchExecutor.shutdownNow();
  }

  private void load(String address, PoolMetadata hint, CompletableFuture<PoolMetadata> future) {
    try {
      PoolMetadata pool;
      if (hint != null && hint.address().equals(address)) {
        pool = hint;
        publish(pool, true);
        count("hint");
      } else {
        Optional<PoolMetadata> stored = writer.findPool(address);
        if (stored.isPresent()) {
          pool = stored.get();
          publish(pool, false);
          count("store");
        } else {
          pool = fetcher.fetch(address);
          publish(pool, true);
          count("fetched");
        }
      }
      future.complete(pool);
    } catch (MetadataUnresolvableException ex) {
      unresolvableUntil.put(address, clock.instant().plus(negativeTtl));
      count("unresolvable");
      log.debug("Pool unresolvable address={} reason={}", address, ex.getMessage());
      future.completeExceptionally(ex);
    } catch (RuntimeException ex) {
      count("error");
      future.completeExceptionally(ex);
    } finally {
      inFlight.remove(address, future);
    }
  }

  private void publish(PoolMetadata pool, boolean persist) {
    boolean inserted = persist && writer.writePool(pool);
    pools.put(pool.address(), pool);
    if (inserted) {
      log.info(
          "Pool registered address={} dex={} mintA={} mintB={}",
          pool.address(),
          pool.dexKind().storageName(),
          pool.mintA(),
          pool.mintB());
      if (pool.nativeSide().isPresent()) {
        listener.onPoolRegistered(pool);
      }
    }
  }

  private void rejectIfRecentlyUnresolvable(String address) {
    Instant until = unresolvableUntil.get(address);
    if (until == null) {
      return;
    }
    if (clock.instant().isBefore(until)) {
      count("negative_cached");
      throw new MetadataUnresolvableException(address, "Pool recently unresolvable: " + address);
    }
    unresolvableUntil.remove(address, until);
  }

  private PoolMetadata await(String address, CompletableFuture<PoolMetadata> future) {
    try {
      return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      count("timeout");
      throw new MetadataUnresolvableException(
          address, "Pool metadata fetch timed out after " + fetchTimeout.toMillis() + "ms", ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new PoolFetchException(address, "Interrupted while resolving pool " + address, ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof MetadataUnresolvableException unresolvable) {
        throw unresolvable;
      }
      if (cause instanceof IngestionFatalException fatal) {
        throw fatal;
      }
      throw new PoolFetchException(address, "Pool metadata fetch failed for " + address, cause);
    }
  }

  private void count(String outcome) {
    meterRegistry.counter(FETCH_COUNTER, "outcome", outcome).increment();
  }

  private static ExecutorService newFetchExecutor(int fetchConcurrency) {
    AtomicInteger sequence = new AtomicInteger();
    return Executors.newFixedThreadPool(
        Math.max(1, fetchConcurrency),
        runnable -> {
          Thread thread = new Thread(runnable, "pool-fetch-" + sequence.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        });
  }
}
