package com.soldexhub.ingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.TradeNormalizer;
import com.soldexhub.integration.solana.RetryBackoff;
import com.soldexhub.integration.solana.accounts.PoolMetadataFetcher;
import com.soldexhub.integration.solana.accounts.RpcPoolMetadataFetcher;
import com.soldexhub.integration.solana.decode.DexDecoders;
import com.soldexhub.integration.solana.decode.TransactionDecoder;
import com.soldexhub.integration.solana.rpc.HttpSolanaRpcClient;
import com.soldexhub.integration.solana.rpc.RpcRetryExecutor;
import com.soldexhub.integration.solana.rpc.SolanaRpcClient;
import com.soldexhub.integration.solana.rpc.SolanaRpcConfig;
import com.soldexhub.integration.solana.stream.SolanaStreamClient;
import com.soldexhub.integration.solana.stream.SolanaStreamConfig;
import com.soldexhub.integration.solana.stream.WebSocketSolanaStreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SolanaConnectorProperties.class)
public class SolanaConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock ingestClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean(name = "solanaHttpClient")
  public HttpClient solanaHttpClient(SolanaConnectorProperties properties) {
    return HttpClient.newBuilder().connectTimeout(properties.getStream().getConnectTimeout()).build();
  }

  @Bean
  @ConditionalOnMissingBean
  public SolanaRpcConfig solanaRpcConfig(SolanaConnectorProperties properties) {
    SolanaConnectorProperties.Rpc rpc = properties.getRpc();
    return new SolanaRpcConfig(
        URI.create(rpc.getUrl()),
        rpc.getCommitment(),
        rpc.getTimeout(),
        rpc.getMaxAttempts(),
        rpc.getRetryBaseBackoff(),
        rpc.getRetryMaxBackoff());
  }

  @Bean
  @ConditionalOnMissingBean
  public RpcRetryExecutor rpcRetryExecutor(SolanaRpcConfig config, MeterRegistry meterRegistry) {
    return new RpcRetryExecutor(
        config.maxAttempts(),
        new RetryBackoff(config.retryBaseBackoff(), config.retryMaxBackoff(), true),
        meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public SolanaRpcClient solanaRpcClient(
      HttpClient solanaHttpClient, SolanaRpcConfig config, RpcRetryExecutor rpcRetryExecutor) {
    return new HttpSolanaRpcClient(solanaHttpClient, new ObjectMapper(), config, rpcRetryExecutor);
  }

  @Bean
  @ConditionalOnMissingBean
  public DexDecoders dexDecoders(SolanaConnectorProperties properties) {
    return DexDecoders.standard().restrictTo(subscribedKinds(properties));
  }

  @Bean
  @ConditionalOnMissingBean
  public TransactionDecoder transactionDecoder(DexDecoders dexDecoders, MeterRegistry meterRegistry) {
    return new TransactionDecoder(dexDecoders, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public PoolMetadataFetcher poolMetadataFetcher(SolanaRpcClient solanaRpcClient) {
    return new RpcPoolMetadataFetcher(solanaRpcClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public TradeNormalizer tradeNormalizer() {
    return new TradeNormalizer();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "solana.stream", name = "enabled", havingValue = "true", matchIfMissing = true)
  public SolanaStreamClient solanaStreamClient(
      HttpClient solanaHttpClient,
      SolanaConnectorProperties properties,
      MeterRegistry meterRegistry,
      Clock ingestClock) {
    SolanaConnectorProperties.Stream stream = properties.getStream();
    List<String> programIds =
        subscribedKinds(properties).stream().map(DexKind::programId).distinct().toList();
    SolanaStreamConfig config =
        new SolanaStreamConfig(
            URI.create(stream.getUrl()),
            programIds,
            stream.getCommitment(),
            stream.getConnectTimeout(),
            stream.getPingInterval(),
            stream.getReconnectBaseBackoff(),
            stream.getReconnectMaxBackoff(),
            stream.getStableConnectionReset(),
            stream.getMaxConsecutiveFailures(),
            ingestClock);
    return new WebSocketSolanaStreamClient(solanaHttpClient, new ObjectMapper(), config, meterRegistry);
  }

  static Set<DexKind> subscribedKinds(SolanaConnectorProperties properties) {
    List<DexKind> programs = properties.getStream().getPrograms();
    if (programs == null || programs.isEmpty()) {
      throw new IllegalStateException("solana.stream.programs must name at least one dex kind");
    }
    return EnumSet.copyOf(programs);
  }
}
