package com.soldexhub.ingest.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.ingest.IngestionFatalException;
import com.soldexhub.ingest.config.IngestProperties;
import com.soldexhub.ingest.pipeline.IngestPipeline;
import com.soldexhub.ingest.pipeline.RawUpdate;
import com.soldexhub.ingest.pipeline.UpdateSource;
import com.soldexhub.ingest.pool.PoolRegistry;
import com.soldexhub.integration.solana.stream.LogsNotification;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class LogsStreamSupervisorTest {
  private static final String RAYDIUM = DexKind.RAYDIUM_AMM.programId();
  private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private final SolanaStreamClient streamClient = mock(SolanaStreamClient.class);
  private final IngestPipeline pipeline = mock(IngestPipeline.class);
  private final PoolRegistry poolRegistry = mock(PoolRegistry.class);
  private final GapBackfiller backfiller = mock(GapBackfiller.class);
  private final IngestProperties properties = new IngestProperties();
  private final LogsStreamSupervisor supervisor =
      new LogsStreamSupervisor(
          streamClient,
          pipeline,
          poolRegistry,
          backfiller,
          properties,
          Clock.fixed(NOW, ZoneOffset.UTC));

  @Test
  void shouldWarmUpStartPipelineAndBackfillBeforeSubscribing() {
    properties.getPoolRegistry().setWarmupLimit(500);

    supervisor.start();

    InOrder order = inOrder(poolRegistry, pipeline, backfiller, streamClient);
    order.verify(poolRegistry).warmUp(500);
    order.verify(pipeline).start();
    order.verify(backfiller).seedFromStore();
    order.verify(backfiller).requestBackfill(BackfillTrigger.STARTUP);
    order.verify(streamClient).start(supervisor);
  }

  @Test
  void shouldSkipBackfillWhenDisabled() {
    properties.getBackfill().setEnabled(false);

    supervisor.start();
    supervisor.onConnected(2L);

    verify(backfiller, never()).seedFromStore();
    verify(backfiller, never()).requestBackfill(any());
    verify(streamClient).start(supervisor);
  }

  @Test
  void shouldBackfillOnlyAfterReconnect() {
    supervisor.onConnected(1L);
    verify(backfiller, never()).requestBackfill(any());

    supervisor.onConnected(2L);
    verify(backfiller).requestBackfill(BackfillTrigger.RECONNECT);
  }

  @Test
  void shouldForwardNotificationsAndTrackLastSeenSignature() {
    CompletableFuture<Void> accepted = new CompletableFuture<>();
    when(pipeline.isAccepting()).thenReturn(true);
    when(pipeline.submit(any())).thenReturn(accepted);

    CompletionStage<Void> stage =
        supervisor.onLogs(new LogsNotification(RAYDIUM, "sig-1", 322_000_000L, List.of("log"), false));

    assertSame(accepted, stage);
    verify(backfiller).recordSeen(RAYDIUM, "sig-1");
    ArgumentCaptor<RawUpdate> update = ArgumentCaptor.forClass(RawUpdate.class);
    verify(pipeline).submit(update.capture());
    assertEquals("sig-1", update.getValue().signature());
    assertEquals(322_000_000L, update.getValue().slot());
    assertEquals(UpdateSource.STREAM, update.getValue().source());
    assertEquals(NOW, update.getValue().arrivedAt());
  }

  @Test
  void shouldNotAnchorBackfillOnFailedTransactions() {
    when(pipeline.isAccepting()).thenReturn(true);
    when(pipeline.submit(any())).thenReturn(CompletableFuture.completedFuture(null));

    supervisor.onLogs(new LogsNotification(RAYDIUM, "sig-failed", 1L, List.of(), true));

    verify(backfiller, never()).recordSeen(anyString(), anyString());
    verify(pipeline).submit(any());
  }

  @Test
  void shouldFailPipelineWhenStreamGivesUp() {
    supervisor.onFatal("RETRIES_EXHAUSTED", "10 consecutive failures", null);

    ArgumentCaptor<IngestionFatalException> error = ArgumentCaptor.forClass(IngestionFatalException.class);
    verify(pipeline).fail(error.capture());
    assertTrue(error.getValue().getMessage().contains("RETRIES_EXHAUSTED"));
  }

  @Test
  void shouldDrainPipelineBeforeClosingStream() {
    supervisor.stop();

    InOrder order = inOrder(backfiller, pipeline, streamClient);
    order.verify(backfiller).stop();
    order.verify(pipeline).shutdown();
    order.verify(streamClient).stop();
  }
}
