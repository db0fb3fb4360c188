package com.soldexhub.ingest.stream;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.ingest.pipeline.IngestPipeline;
import com.soldexhub.ingest.pipeline.RawUpdate;
import com.soldexhub.ingest.trade.TradeRepository;
import com.soldexhub.integration.solana.rpc.SignatureInfo;
import com.soldexhub.integration.solana.rpc.SolanaRpcClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays signatures the stream may have missed. For each program the anchor is the last signature seen
 * for it; everything newer is paged newest-first and then fed to the pipeline oldest-first. Overlap with
 * the live stream is expected and filtered downstream.
 */
public class GapBackfiller {
  private static final Logger log = LoggerFactory.getLogger(GapBackfiller.class);
  private static final String BACKFILL_COUNTER = "ingest.backfill.total";

  private final SolanaRpcClient rpcClient;
  private final TradeRepository tradeRepository;
  private final IngestPipeline pipeline;
  private final Set<DexKind> programs;
  private final int maxSignatures;
  private final int pageSize;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final ExecutorService executor;
  private final Map<DexKind, String> lastSeen = new ConcurrentHashMap<>();
  private final AtomicBoolean inProgress = new AtomicBoolean(false);

  public GapBackfiller(
      SolanaRpcClient rpcClient,
      TradeRepository tradeRepository,
      IngestPipeline pipeline,
      Set<DexKind> programs,
      int maxSignatures,
      int pageSize,
      MeterRegistry meterRegistry) {
    this(
        rpcClient,
        tradeRepository,
        pipeline,
        programs,
        maxSignatures,
        pageSize,
        meterRegistry,
        Clock.systemUTC(),
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "ingest-backfill");
              thread.setDaemon(true);
              return thread;
            }));
  }

  GapBackfiller(
      SolanaRpcClient rpcClient,
      TradeRepository tradeRepository,
      IngestPipeline pipeline,
      Set<DexKind> programs,
      int maxSignatures,
      int pageSize,
      MeterRegistry meterRegistry,
      Clock clock,
      ExecutorService executor) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
    this.tradeRepository = Objects.requireNonNull(tradeRepository, "tradeRepository must not be null");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
    this.programs = Set.copyOf(programs);
    this.maxSignatures = Math.max(1, maxSignatures);
    this.pageSize = Math.max(1, Math.min(1_000, pageSize));
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
  }

  public void recordSeen(String programId, String signature) {
    DexKind.fromProgramId(programId).ifPresent(kind -> lastSeen.put(kind, signature));
  }

  /** Uses the newest stored trade of each dex as its anchor, unless the stream already supplied one. */
  public void seedFromStore() {
    for (DexKind kind : programs) {
      tradeRepository.findLatestTxid(kind).ifPresent(txid -> lastSeen.putIfAbsent(kind, txid));
    }
    log.info("Backfill anchors seeded anchors={} programs={}", lastSeen.size(), programs.size());
  }

  public Optional<String> anchor(DexKind kind) {
    return Optional.ofNullable(lastSeen.get(kind));
  }

  /**
   * Schedules one backfill pass with the anchors as they are now. A pass already running absorbs the
   * request.
   *
   * @return {@code true} if a pass was scheduled
   */
  public boolean requestBackfill(BackfillTrigger trigger) {
    Map<DexKind, String> anchors = new EnumMap<>(DexKind.class);
    anchors.putAll(lastSeen);
    if (!inProgress.compareAndSet(false, true)) {
      count(trigger, "skipped");
      return false;
    }
    try {
      executor.execute(
          () -> {
            try {
              run(trigger, anchors);
            } finally {
              inProgress.set(false);
            }
          });
      return true;
    } catch (RejectedExecutionException ex) {
      inProgress.set(false);
      count(trigger, "skipped");
      return false;
    }
  }

  public void stop() {
    executor.shutdownNow();
  }

  void run(BackfillTrigger trigger, Map<DexKind, String> anchors) {
    for (DexKind kind : programs) {
      String anchor = anchors.get(kind);
      if (anchor == null) {
        count(trigger, "no_anchor");
        log.info("Backfill skipped trigger={} dex={} reason=no_anchor", trigger.tag(), kind.storageName());
        continue;
      }
      try {
        int replayed = replay(kind, anchor);
        if (replayed < 0) {
          count(trigger, "aborted");
          return;
        }
        count(trigger, "completed");
        log.info(
            "Backfill completed trigger={} dex={} replayed={}", trigger.tag(), kind.storageName(), replayed);
      } catch (RuntimeException ex) {
        count(trigger, "failed");
        log.warn(
            "Backfill failed trigger={} dex={} error={}",
            trigger.tag(),
            kind.storageName(),
            ex.getMessage());
      }
    }
  }

  /** @return number of signatures handed to the pipeline, or -1 if it stopped accepting */
  private int replay(DexKind kind, String anchor) {
    List<SignatureInfo> collected = new ArrayList<>();
    String before = null;
    while (collected.size() < maxSignatures) {
      int limit = Math.min(pageSize, maxSignatures - collected.size());
      List<SignatureInfo> page = rpcClient.getSignaturesForAddress(kind.programId(), anchor, before, limit);
      if (page.isEmpty()) {
        break;
      }
      collected.addAll(page);
      before = page.get(page.size() - 1).signature();
      if (page.size() < limit) {
        break;
      }
    }
    Collections.reverse(collected);
    for (SignatureInfo signature : collected) {
      if (!pipeline.enqueue(RawUpdate.fromBackfill(signature, kind.programId(), clock.instant()))) {
        return -1;
      }
    }
    return collected.size();
  }

  private void count(BackfillTrigger trigger, String outcome) {
    meterRegistry.counter(BACKFILL_COUNTER, "trigger", trigger.tag(), "outcome", outcome).increment();
  }
}
