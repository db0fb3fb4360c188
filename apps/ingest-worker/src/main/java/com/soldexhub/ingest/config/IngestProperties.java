package com.soldexhub.ingest.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingest")
public class IngestProperties {
  private boolean enabled = true;
  private Pipeline pipeline = new Pipeline();
  private PoolRegistry poolRegistry = new PoolRegistry();
  private Sequencer sequencer = new Sequencer();
  private Writer writer = new Writer();
  private Backfill backfill = new Backfill();
  private Publication publication = new Publication();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public Pipeline getPipeline() {
    return pipeline;
  }

  public void setPipeline(Pipeline pipeline) {
    this.pipeline = pipeline;
  }

  public PoolRegistry getPoolRegistry() {
    return poolRegistry;
  }

  public void setPoolRegistry(PoolRegistry poolRegistry) {
    this.poolRegistry = poolRegistry;
  }

  public Sequencer getSequencer() {
    return sequencer;
  }

  public void setSequencer(Sequencer sequencer) {
    this.sequencer = sequencer;
  }

  public Writer getWriter() {
    return writer;
  }

  public void setWriter(Writer writer) {
    this.writer = writer;
  }

  public Backfill getBackfill() {
    return backfill;
  }

  public void setBackfill(Backfill backfill) {
    this.backfill = backfill;
  }

  public Publication getPublication() {
    return publication;
  }

  public void setPublication(Publication publication) {
    this.publication = publication;
  }

  public static class Pipeline {
    private int inboundCapacity = 10_000;
    private int decodeWorkers = 8;
    private int inFlightWindow = 256;
    private int lanes = 8;
    private int laneCapacity = 1_024;
    private int recentSignatures = 100_000;
    private Duration drainTimeout = Duration.ofSeconds(30);

    public int getInboundCapacity() {
      return inboundCapacity;
    }

    public void setInboundCapacity(int inboundCapacity) {
      this.inboundCapacity = inboundCapacity;
    }

    public int getDecodeWorkers() {
      return decodeWorkers;
    }

    public void setDecodeWorkers(int decodeWorkers) {
      this.decodeWorkers = decodeWorkers;
    }

    public int getInFlightWindow() {
      return inFlightWindow;
    }

    public void setInFlightWindow(int inFlightWindow) {
      this.inFlightWindow = inFlightWindow;
    }

    public int getLanes() {
      return lanes;
    }

    public void setLanes(int lanes) {
      this.lanes = lanes;
    }

    public int getLaneCapacity() {
      return laneCapacity;
    }

    public void setLaneCapacity(int laneCapacity) {
      this.laneCapacity = laneCapacity;
    }

    public int getRecentSignatures() {
      return recentSignatures;
    }

    public void setRecentSignatures(int recentSignatures) {
      this.recentSignatures = recentSignatures;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }
  }

  public static class PoolRegistry {
    private Duration fetchTimeout = Duration.ofSeconds(5);
    private Duration negativeTtl = Duration.ofMinutes(10);
    private int warmupLimit = 100_000;
    private int fetchConcurrency = 4;

    public Duration getFetchTimeout() {
      return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
      this.fetchTimeout = fetchTimeout;
    }

    public Duration getNegativeTtl() {
      return negativeTtl;
    }

    public void setNegativeTtl(Duration negativeTtl) {
      this.negativeTtl = negativeTtl;
    }

    public int getWarmupLimit() {
      return warmupLimit;
    }

    public void setWarmupLimit(int warmupLimit) {
      this.warmupLimit = warmupLimit;
    }

    public int getFetchConcurrency() {
      return fetchConcurrency;
    }

    public void setFetchConcurrency(int fetchConcurrency) {
      this.fetchConcurrency = fetchConcurrency;
    }
  }

  public static class Sequencer {
    private int windowSize = 200_000;

    public int getWindowSize() {
      return windowSize;
    }

    public void setWindowSize(int windowSize) {
      this.windowSize = windowSize;
    }
  }

  public static class Writer {
    private int batchSize = 500;
    private Duration linger = Duration.ofMillis(200);
    private int queueCapacity = 5_000;
    private int maxAttempts = 5;
    private Duration initialBackoff = Duration.ofMillis(200);
    private Duration maxBackoff = Duration.ofSeconds(5);

    public int getBatchSize() {
      return batchSize;
    }

    public void setBatchSize(int batchSize) {
      this.batchSize = batchSize;
    }

    public Duration getLinger() {
      return linger;
    }

    public void setLinger(Duration linger) {
      this.linger = linger;
    }

    public int getQueueCapacity() {
      return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
      this.queueCapacity = queueCapacity;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
      return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
      this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }
  }

  public static class Backfill {
    private boolean enabled = true;
    private int maxSignatures = 5_000;
    private int pageSize = 1_000;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxSignatures() {
      return maxSignatures;
    }

    public void setMaxSignatures(int maxSignatures) {
      this.maxSignatures = maxSignatures;
    }

    public int getPageSize() {
      return pageSize;
    }

    public void setPageSize(int pageSize) {
      this.pageSize = pageSize;
    }
  }

  public static class Publication {
    private boolean enabled = true;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }
  }
}
