package com.soldexhub.ingest.config;

import com.soldexhub.domain.trades.TradeNormalizer;
import com.soldexhub.infra.kafka.producer.DexEventProducer;
import com.soldexhub.ingest.health.IngestHealthIndicator;
import com.soldexhub.ingest.pipeline.ContextClosingFatalErrorHandler;
import com.soldexhub.ingest.pipeline.FatalErrorHandler;
import com.soldexhub.ingest.pipeline.IngestPipeline;
import com.soldexhub.ingest.pipeline.IngestStatus;
import com.soldexhub.ingest.pool.PoolRegistry;
import com.soldexhub.ingest.pool.PoolRepository;
import com.soldexhub.ingest.publication.DexEventPublication;
import com.soldexhub.ingest.publication.KafkaDexEventPublication;
import com.soldexhub.ingest.publication.NoOpDexEventPublication;
import com.soldexhub.ingest.stream.GapBackfiller;
import com.soldexhub.ingest.trade.PersistenceWriter;
import com.soldexhub.ingest.trade.TradeRepository;
import com.soldexhub.ingest.trade.TradeSequencer;
import com.soldexhub.integration.solana.accounts.PoolMetadataFetcher;
import com.soldexhub.integration.solana.decode.TransactionDecoder;
import com.soldexhub.integration.solana.rpc.SolanaRpcClient;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IngestProperties.class)
@ConditionalOnProperty(prefix = "ingest", name = "enabled", havingValue = "true", matchIfMissing = true)
public class IngestConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public PersistenceWriter persistenceWriter(
      TradeRepository tradeRepository,
      PoolRepository poolRepository,
      IngestProperties properties,
      MeterRegistry meterRegistry) {
    IngestProperties.Writer writer = properties.getWriter();
    return new PersistenceWriter(
        tradeRepository,
        poolRepository,
        writer.getMaxAttempts(),
        writer.getInitialBackoff(),
        writer.getMaxBackoff(),
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public DexEventPublication dexEventPublication(
      IngestProperties properties,
      ObjectProvider<DexEventProducer> dexEventProducer,
      MeterRegistry meterRegistry) {
    DexEventProducer producer = dexEventProducer.getIfAvailable();
    if (!properties.getPublication().isEnabled() || producer == null) {
      return new NoOpDexEventPublication();
    }
    return new KafkaDexEventPublication(producer, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PoolRegistry poolRegistry(
      PoolMetadataFetcher poolMetadataFetcher,
      PoolRepository poolRepository,
      PersistenceWriter persistenceWriter,
      IngestProperties properties,
      MeterRegistry meterRegistry,
      DexEventPublication dexEventPublication) {
    IngestProperties.PoolRegistry registry = properties.getPoolRegistry();
    return new PoolRegistry(
        poolMetadataFetcher,
        poolRepository,
        persistenceWriter,
        registry.getFetchConcurrency(),
        registry.getFetchTimeout(),
        registry.getNegativeTtl(),
        meterRegistry,
        dexEventPublication);
  }

  @Bean
  @ConditionalOnMissingBean
  public TradeSequencer tradeSequencer(IngestProperties properties) {
    return new TradeSequencer(properties.getSequencer().getWindowSize());
  }

  @Bean
  @ConditionalOnMissingBean
  public IngestStatus ingestStatus() {
    return new IngestStatus();
  }

  @Bean
  @ConditionalOnMissingBean
  public FatalErrorHandler fatalErrorHandler(ConfigurableApplicationContext applicationContext) {
    return new ContextClosingFatalErrorHandler(applicationContext);
  }

  @Bean
  @ConditionalOnMissingBean
  public IngestPipeline ingestPipeline(
      SolanaRpcClient solanaRpcClient,
      TransactionDecoder transactionDecoder,
      PoolRegistry poolRegistry,
      TradeNormalizer tradeNormalizer,
      TradeSequencer tradeSequencer,
      PersistenceWriter persistenceWriter,
      DexEventPublication dexEventPublication,
      IngestStatus ingestStatus,
      FatalErrorHandler fatalErrorHandler,
      IngestProperties properties,
      MeterRegistry meterRegistry) {
    return new IngestPipeline(
        solanaRpcClient,
        transactionDecoder,
        poolRegistry,
        tradeNormalizer,
        tradeSequencer,
        persistenceWriter,
        dexEventPublication,
        ingestStatus,
        fatalErrorHandler,
        pipelineSettings(properties),
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public GapBackfiller gapBackfiller(
      SolanaRpcClient solanaRpcClient,
      TradeRepository tradeRepository,
      IngestPipeline ingestPipeline,
      SolanaConnectorProperties solanaProperties,
      IngestProperties properties,
      MeterRegistry meterRegistry) {
    IngestProperties.Backfill backfill = properties.getBackfill();
    return new GapBackfiller(
        solanaRpcClient,
        tradeRepository,
        ingestPipeline,
        SolanaConfiguration.subscribedKinds(solanaProperties),
        backfill.getMaxSignatures(),
        backfill.getPageSize(),
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public IngestHealthIndicator ingestHealthIndicator(
      IngestStatus ingestStatus, ObjectProvider<SolanaStreamClient> solanaStreamClient) {
    return new IngestHealthIndicator(ingestStatus, solanaStreamClient);
  }

  static IngestPipeline.Settings pipelineSettings(IngestProperties properties) {
    IngestProperties.Pipeline pipeline = properties.getPipeline();
    IngestProperties.Writer writer = properties.getWriter();
    return new IngestPipeline.Settings(
        pipeline.getInboundCapacity(),
        pipeline.getDecodeWorkers(),
        pipeline.getInFlightWindow(),
        pipeline.getLanes(),
        pipeline.getLaneCapacity(),
        pipeline.getRecentSignatures(),
        pipeline.getDrainTimeout(),
        writer.getBatchSize(),
        writer.getLinger(),
        writer.getQueueCapacity());
  }
}
