package com.soldexhub.ingest.pipeline;

import com.soldexhub.domain.trades.CurveCompletedEvent;
import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.MetadataUnresolvableException;
import com.soldexhub.domain.trades.PoolCreatedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.SwapEvent;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.domain.trades.TradeDomainException;
import com.soldexhub.domain.trades.TradeNormalizer;
import com.soldexhub.domain.trades.TradeRejectedException;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.pool.PoolFetchException;
import com.soldexhub.ingest.pool.PoolRegistry;
import com.soldexhub.ingest.publication.DexEventPublication;
import com.soldexhub.ingest.trade.PersistenceWriter;
import com.soldexhub.ingest.trade.TradeSequencer;
import com.soldexhub.ingest.trade.WriteResult;
import com.soldexhub.integration.solana.decode.DecodeResult;
import com.soldexhub.integration.solana.decode.TransactionDecoder;
import com.soldexhub.integration.solana.rpc.SolanaRpcClient;
import com.soldexhub.integration.solana.rpc.SolanaTransaction;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves raw updates through hydration, decoding, pool resolution, normalization and persistence.
 *
 * <pre>
 * inbound -> dispatcher -> decode workers -> in-flight window (arrival order) -> router
 *         -> lane[floorMod(poolHash, lanes)] -> outbound -> writer
 * </pre>
 *
 * <p>Every queue is bounded and every producer blocks when its consumer falls behind, so a slow store ends
 * up pausing the stream. Events for one pool always go through the same lane. Shutdown stops intake and
 * lets each stage drain before the next one exits.
 */
public class IngestPipeline {
  private static final Logger log = LoggerFactory.getLogger(IngestPipeline.class);
  private static final String DROPPED_COUNTER = "ingest.events.dropped.total";
  private static final String QUEUE_DEPTH_GAUGE = "ingest.pipeline.queue.depth";
  private static final long IDLE_POLL_MILLIS = 50L;

  private final SolanaRpcClient rpcClient;
  private final TransactionDecoder decoder;
  private final PoolRegistry poolRegistry;
  private final TradeNormalizer normalizer;
  private final TradeSequencer sequencer;
  private final PersistenceWriter writer;
  private final DexEventPublication publication;
  private final IngestStatus status;
  private final FatalErrorHandler fatalErrorHandler;
  private final Settings settings;
  private final MeterRegistry meterRegistry;

  private final BlockingQueue<RawUpdate> inbound;
  private final BlockingQueue<CompletableFuture<DecodeResult>> inFlight;
  private final List<BlockingQueue<DexEvent>> lanes;
  private final BlockingQueue<Trade> outbound;
  private final Map<String, Boolean> recentSignatures;
  private final AtomicLong arrivalSequence = new AtomicLong();

  private final ExecutorService decodeExecutor;
  private final ExecutorService handoffExecutor;
  private final List<Thread> threads = new CopyOnWriteArrayList<>();

  private volatile boolean accepting;
  private volatile boolean aborted;
  private volatile boolean dispatcherDone;
  private volatile boolean routerDone;
  private final AtomicInteger lanesRunning = new AtomicInteger();

  public IngestPipeline(
      SolanaRpcClient rpcClient,
      TransactionDecoder decoder,
      PoolRegistry poolRegistry,
      TradeNormalizer normalizer,
      TradeSequencer sequencer,
      PersistenceWriter writer,
      DexEventPublication publication,
      IngestStatus status,
      FatalErrorHandler fatalErrorHandler,
      Settings settings,
      MeterRegistry meterRegistry) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
    this.poolRegistry = Objects.requireNonNull(poolRegistry, "poolRegistry must not be null");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    this.sequencer = Objects.requireNonNull(sequencer, "sequencer must not be null");
    this.writer = Objects.requireNonNull(writer, "writer must not be null");
    this.publication = Objects.requireNonNull(publication, "publication must not be null");
    this.status = Objects.requireNonNull(status, "status must not be null");
    this.fatalErrorHandler = Objects.requireNonNull(fatalErrorHandler, "fatalErrorHandler must not be null");
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");

    this.inbound = new ArrayBlockingQueue<>(settings.inboundCapacity());
    this.inFlight = new ArrayBlockingQueue<>(settings.inFlightWindow());
    List<BlockingQueue<DexEvent>> laneQueues = new ArrayList<>(settings.lanes());
    for (int i = 0; i < settings.lanes(); i++) {
      laneQueues.add(new ArrayBlockingQueue<>(settings.laneCapacity()));
    }
    this.lanes = List.copyOf(laneQueues);
    this.outbound = new ArrayBlockingQueue<>(settings.outboundCapacity());
    int recentLimit = settings.recentSignatures();
    this.recentSignatures =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
            return size() > recentLimit;
          }
        };
    this.decodeExecutor = Executors.newFixedThreadPool(settings.decodeWorkers(), namedThreads("ingest-decode-"));
    this.handoffExecutor = Executors.newSingleThreadExecutor(namedThreads("ingest-handoff-"));

    meterRegistry.gauge(QUEUE_DEPTH_GAUGE, Tags.of("queue", "inbound"), inbound, BlockingQueue::size);
    meterRegistry.gauge(QUEUE_DEPTH_GAUGE, Tags.of("queue", "in_flight"), inFlight, BlockingQueue::size);
    meterRegistry.gauge(QUEUE_DEPTH_GAUGE, Tags.of("queue", "lanes"), this, IngestPipeline::laneDepth);
    meterRegistry.gauge(QUEUE_DEPTH_GAUGE, Tags.of("queue", "outbound"), outbound, BlockingQueue::size);
  }

  public synchronized void start() {
    if (!status.transition(IngestStatus.State.STARTING, IngestStatus.State.RUNNING)) {
      throw new IllegalStateException("Pipeline cannot start from state " + status.state());
    }
    accepting = true;
    threads.add(newThread("ingest-dispatcher", this::runDispatcher));
    threads.add(newThread("ingest-router", this::runRouter));
    lanesRunning.set(lanes.size());
    for (int i = 0; i < lanes.size(); i++) {
      BlockingQueue<DexEvent> lane = lanes.get(i);
      threads.add(newThread("ingest-lane-" + i, () -> runLane(lane)));
    }
    threads.add(newThread("ingest-writer", this::runWriter));
    threads.forEach(Thread::start);
    log.info(
        "Ingest pipeline started decodeWorkers={} lanes={} batchSize={}",
        settings.decodeWorkers(),
        lanes.size(),
        settings.batchSize());
  }

  /**
   * Offers a streamed update. The returned stage completes once the update sits in the inbound queue; while
   * the queue is full it stays pending, which holds back the next frame.
   */
  public CompletionStage<Void> submit(RawUpdate update) {
    if (!accepting) {
      drop("shutdown");
      return CompletableFuture.completedFuture(null);
    }
    RawUpdate stamped = update.withArrivalSequence(arrivalSequence.incrementAndGet());
    if (inbound.offer(stamped)) {
      return CompletableFuture.completedFuture(null);
    }
    return CompletableFuture.runAsync(() -> putInbound(stamped), handoffExecutor);
  }

  /** Blocking variant for backfill. Returns {@code false} once the pipeline no longer accepts updates. */
  public boolean enqueue(RawUpdate update) {
    if (!accepting) {
      return false;
    }
    return putInbound(update.withArrivalSequence(arrivalSequence.incrementAndGet()));
  }

  public boolean isAccepting() {
    return accepting;
  }

  public IngestStatus status() {
    return status;
  }

  /** Stops intake and waits up to the drain timeout for every stage to empty, flushing the last batch. */
  public void shutdown() {
    if (!status.transition(IngestStatus.State.RUNNING, IngestStatus.State.DRAINING)) {
      stopExecutors();
      return;
    }
    accepting = false;
    log.info("Ingest pipeline draining inbound={} outbound={}", inbound.size(), outbound.size());
    long deadline = System.nanoTime() + settings.drainTimeout().toNanos();
    boolean drained = joinAll(deadline);
    if (!drained) {
      log.warn(
          "Ingest pipeline drain timed out timeoutMs={} inbound={} outbound={}",
          settings.drainTimeout().toMillis(),
          inbound.size(),
          outbound.size());
      aborted = true;
      threads.forEach(Thread::interrupt);
    }
    stopExecutors();
    status.transition(IngestStatus.State.DRAINING, IngestStatus.State.STOPPED);
    log.info("Ingest pipeline stopped drained={}", drained);
  }

  /** Marks the pipeline FAILED, halts every stage and hands the error to the fatal handler once. */
  public void fail(IngestionFatalException error) {
    if (!status.markFailed(error.getMessage())) {
      return;
    }
    log.error("Ingest pipeline failed reason={}", error.getMessage(), error);
    accepting = false;
    aborted = true;
    Thread current = Thread.currentThread();
    for (Thread thread : threads) {
      if (thread != current) {
        thread.interrupt();
      }
    }
    stopExecutors();
    fatalErrorHandler.onFatal(error);
  }

  int laneDepth() {
    int depth = 0;
    for (BlockingQueue<DexEvent> lane : lanes) {
      depth += lane.size();
    }
    return depth;
  }

  private boolean putInbound(RawUpdate update) {
    try {
      inbound.put(update);
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      drop("shutdown");
      return false;
    }
  }

  private void runDispatcher() {
    try {
      while (!aborted) {
        RawUpdate update = inbound.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (update == null) {
          if (!accepting && inbound.isEmpty()) {
            break;
          }
          continue;
        }
        dispatch(update);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      dispatcherDone = true;
    }
  }

  private void dispatch(RawUpdate update) throws InterruptedException {
    if (update.failed()) {
      drop("failed_transaction");
      return;
    }
    if (recentSignatures.put(update.signature(), Boolean.TRUE) != null) {
      drop("duplicate_signature");
      return;
    }
    CompletableFuture<DecodeResult> future =
        CompletableFuture.supplyAsync(() -> hydrateAndDecode(update), decodeExecutor);
    inFlight.put(future);
  }

  private DecodeResult hydrateAndDecode(RawUpdate update) {
    try {
      Optional<SolanaTransaction> transaction = rpcClient.getTransaction(update.signature());
      if (transaction.isEmpty()) {
        drop("hydration_failed");
        log.debug("Transaction not available signature={} source={}", update.signature(), update.source());
        return DecodeResult.empty();
      }
      if (transaction.get().failed()) {
        drop("failed_transaction");
        return DecodeResult.empty();
      }
      return decoder.decode(transaction.get(), update.arrivedAt());
    } catch (RuntimeException ex) {
      drop("hydration_failed");
      log.warn(
          "Transaction hydration failed signature={} source={} error={}",
          update.signature(),
          update.source(),
          ex.getClass().getSimpleName());
      return DecodeResult.empty();
    }
  }

  private void runRouter() {
    try {
      while (!aborted) {
        CompletableFuture<DecodeResult> future = inFlight.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (future == null) {
          if (dispatcherDone && inFlight.isEmpty()) {
            break;
          }
          continue;
        }
        DecodeResult result;
        try {
          result = future.get();
        } catch (ExecutionException ex) {
          result = DecodeResult.empty();
        }
        for (DexEvent event : result.events()) {
          lanes.get(laneFor(event.partitionKey())).put(event);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      routerDone = true;
    }
  }

  int laneFor(String partitionKey) {
    return Math.floorMod(partitionKey.hashCode(), lanes.size());
  }

  private void runLane(BlockingQueue<DexEvent> lane) {
    try {
      while (!aborted) {
        DexEvent event = lane.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (event == null) {
          if (routerDone && lane.isEmpty()) {
            break;
          }
          continue;
        }
        process(event);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (IngestionFatalException ex) {
      fail(ex);
    } finally {
      lanesRunning.decrementAndGet();
    }
  }

  private void process(DexEvent event) throws InterruptedException {
    try {
      if (event instanceof SwapEvent swap) {
        PoolMetadata pool = poolRegistry.resolve(swap.poolAddress(), swap.poolHint());
        outbound.put(normalizer.normalize(swap, pool));
      } else if (event instanceof PoolCreatedEvent created) {
        poolRegistry.register(created.pool());
      } else if (event instanceof CurveCompletedEvent completed) {
        publication.curveCompleted(completed);
      }
    } catch (MetadataUnresolvableException ex) {
      drop("metadata_unresolvable");
      log.debug("Event dropped reason=metadata_unresolvable pool={} txid={}", ex.poolAddress(), event.txid());
    } catch (TradeRejectedException ex) {
      drop(ex.reason().tag());
      log.debug("Event dropped reason={} txid={} idx={}", ex.reason().tag(), event.txid(), event.idx());
    } catch (PoolFetchException ex) {
      drop("pool_fetch_failed");
      log.debug("Event dropped reason=pool_fetch_failed pool={} txid={}", ex.poolAddress(), event.txid());
    } catch (TradeDomainException ex) {
      drop("invalid_event");
      log.debug("Event dropped reason=invalid_event txid={} message={}", event.txid(), ex.getMessage());
    } catch (IngestionFatalException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      // the lane must keep draining or the router blocks on it
      drop("unexpected_error");
      log.warn(
          "Event dropped reason=unexpected_error txid={} idx={} error={}",
          event.txid(),
          event.idx(),
          ex.getClass().getSimpleName(),
          ex);
    }
  }

  private void runWriter() {
    List<Trade> batch = new ArrayList<>(settings.batchSize());
    long lingerNanos = settings.linger().toNanos();
    long batchStarted = 0L;
    try {
      while (!aborted) {
        long waitNanos =
            batch.isEmpty() ? lingerNanos : Math.max(0L, batchStarted + lingerNanos - System.nanoTime());
        Trade trade = outbound.poll(waitNanos, TimeUnit.NANOSECONDS);
        if (trade != null) {
          if (batch.isEmpty()) {
            batchStarted = System.nanoTime();
          }
          batch.add(trade);
          if (batch.size() >= settings.batchSize()) {
            flush(batch);
          }
          continue;
        }
        if (!batch.isEmpty()) {
          flush(batch);
        } else if (routerDone && lanesRunning.get() == 0 && outbound.isEmpty()) {
          break;
        }
      }
      if (!aborted && !batch.isEmpty()) {
        flush(batch);
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } catch (IngestionFatalException ex) {
      fail(ex);
    } catch (RuntimeException ex) {
      fail(new IngestionFatalException("Trade writer stopped: " + ex.getClass().getSimpleName(), ex));
    }
  }

  private void flush(List<Trade> batch) {
    List<Trade> admitted = sequencer.admit(batch);
    int filtered = batch.size() - admitted.size();
    batch.clear();
    if (filtered > 0) {
      drop("duplicate", filtered);
    }
    if (admitted.isEmpty()) {
      return;
    }
    WriteResult result = writer.writeTrades(admitted);
    sequencer.markCommitted(admitted);
    if (result.inserted() > 0) {
      publication.tradesRecorded(result.insertedTrades());
    }
  }

  private void drop(String reason) {
    drop(reason, 1);
  }

  private void drop(String reason, int count) {
    meterRegistry.counter(DROPPED_COUNTER, "reason", reason).increment(count);
  }

  private boolean joinAll(long deadlineNanos) {
    for (Thread thread : threads) {
      long remaining = deadlineNanos - System.nanoTime();
      if (remaining <= 0) {
        return false;
      }
      try {
        thread.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return false;
      }
      if (thread.isAlive()) {
        return false;
      }
    }
    return true;
  }

  private void stopExecutors() {
    handoffExecutor.shutdownNow();
    decodeExecutor.shutdownNow();
  }

  private static Thread newThread(String name, Runnable task) {
    Thread thread = new Thread(task, name);
    thread.setDaemon(true);
    return thread;
  }

  private static ThreadFactory namedThreads(String prefix) {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> newThread(prefix + sequence.incrementAndGet(), runnable);
  }

  /** Queue sizes and timings for one pipeline instance. */
  public record Settings(
      int inboundCapacity,
      int decodeWorkers,
      int inFlightWindow,
      int lanes,
      int laneCapacity,
      int recentSignatures,
      Duration drainTimeout,
      int batchSize,
      Duration linger,
      int outboundCapacity) {
    public Settings {
      requirePositive(inboundCapacity, "inboundCapacity");
      requirePositive(decodeWorkers, "decodeWorkers");
      requirePositive(inFlightWindow, "inFlightWindow");
      requirePositive(lanes, "lanes");
      requirePositive(laneCapacity, "laneCapacity");
      requirePositive(recentSignatures, "recentSignatures");
      Objects.requireNonNull(drainTimeout, "drainTimeout must not be null");
      requirePositive(batchSize, "batchSize");
      Objects.requireNonNull(linger, "linger must not be null");
      if (linger.isNegative() || linger.isZero()) {
        throw new IllegalArgumentException("linger must be > 0");
      }
      requirePositive(outboundCapacity, "outboundCapacity");
    }

    private static void requirePositive(int value, String name) {
      if (value <= 0) {
        throw new IllegalArgumentException(name + " must be > 0");
      }
    }
  }
}
