package com.soldexhub.ingest.stream;

import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.config.IngestProperties;
import com.soldexhub.ingest.pipeline.IngestPipeline;
import com.soldexhub.ingest.pipeline.RawUpdate;
import com.soldexhub.ingest.pool.PoolRegistry;
import com.soldexhub.integration.solana.stream.LogsNotification;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import com.soldexhub.integration.solana.stream.SolanaStreamEventHandler;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Owns the ingest lifecycle: warm caches, start the pipeline, backfill, then follow the live stream. */
@Component
@ConditionalOnProperty(
    name = {"ingest.enabled", "solana.stream.enabled"},
    havingValue = "true",
    matchIfMissing = true)
public class LogsStreamSupervisor implements SolanaStreamEventHandler {
  private static final Logger log = LoggerFactory.getLogger(LogsStreamSupervisor.class);

  private final SolanaStreamClient streamClient;
  private final IngestPipeline pipeline;
  private final PoolRegistry poolRegistry;
  private final GapBackfiller backfiller;
  private final IngestProperties properties;
  private final Clock clock;

  public LogsStreamSupervisor(
      SolanaStreamClient streamClient,
      IngestPipeline pipeline,
      PoolRegistry poolRegistry,
      GapBackfiller backfiller,
      IngestProperties properties) {
    this(streamClient, pipeline, poolRegistry, backfiller, properties, Clock.systemUTC());
  }

  LogsStreamSupervisor(
      SolanaStreamClient streamClient,
      IngestPipeline pipeline,
      PoolRegistry poolRegistry,
      GapBackfiller backfiller,
      IngestProperties properties,
      Clock clock) {
    this.streamClient = streamClient;
    this.pipeline = pipeline;
    this.poolRegistry = poolRegistry;
    this.backfiller = backfiller;
    this.properties = properties;
    this.clock = clock;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    poolRegistry.warmUp(properties.getPoolRegistry().getWarmupLimit());
    pipeline.start();
    if (properties.getBackfill().isEnabled()) {
      backfiller.seedFromStore();
      backfiller.requestBackfill(BackfillTrigger.STARTUP);
    }
    streamClient.start(this);
  }

  @PreDestroy
  public void stop() {
    backfiller.stop();
    pipeline.shutdown();
    streamClient.stop();
  }

  @Override
  public void onConnected(long connectionCount) {
    log.info("Logs stream connected connectionCount={}", connectionCount);
    if (connectionCount > 1 && properties.getBackfill().isEnabled()) {
      backfiller.requestBackfill(BackfillTrigger.RECONNECT);
    }
  }

  @Override
  public void onSubscribed(String programId, long subscriptionId) {
    log.info("Logs stream subscribed program={} subscriptionId={}", programId, subscriptionId);
  }

  @Override
  public void onDisconnected(int statusCode, String reason) {
    log.warn("Logs stream disconnected statusCode={} reason={}", statusCode, reason);
  }

  @Override
  public void onReconnectScheduled(long reconnectAttempts, Duration delay) {
    log.info("Logs stream reconnect scheduled attempt={} delayMs={}", reconnectAttempts, delay.toMillis());
  }

  @Override
  public CompletionStage<Void> onLogs(LogsNotification notification) {
    if (!notification.failed()) {
      backfiller.recordSeen(notification.programId(), notification.signature());
    }
    if (!pipeline.isAccepting()) {
      return CompletableFuture.completedFuture(null);
    }
    return pipeline.submit(RawUpdate.fromStream(notification, clock.instant()));
  }

  @Override
  public void onError(String errorCode, String errorMessage, Throwable error) {
    log.warn("Logs stream error errorCode={} message={}", errorCode, errorMessage);
  }

  @Override
  public void onFatal(String errorCode, String errorMessage, Throwable error) {
    pipeline.fail(
        new IngestionFatalException("Logs stream gave up errorCode=" + errorCode + ": " + errorMessage, error));
  }
}
