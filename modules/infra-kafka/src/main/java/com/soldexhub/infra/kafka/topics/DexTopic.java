package com.soldexhub.infra.kafka.topics;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Catalog of the topics the ingest worker writes. Each topic carries exactly one event type.
 *
 * <p>Pool announcements are compacted on the pool address, so a late consumer still sees every pool once.
 * Trades and curve completions are plain retention topics.
 */
public enum DexTopic {
  TRADES_RECORDED("dex.trades.recorded.v1", "TradeRecorded", false),
  POOLS_CREATED("dex.pools.created.v1", "PoolCreated", true),
  CURVES_COMPLETED("dex.curves.completed.v1", "CurveCompleted", false);

  private static final class Names {
    static final Pattern NAME_PATTERN =
        Pattern.compile("^dex(\\.[a-z][a-z0-9]*)+\\.v[1-9][0-9]*$");
  }

  private final String topicName;
  private final String eventType;
  private final boolean compacted;

  DexTopic(String topicName, String eventType, boolean compacted) {
    if (!Names.NAME_PATTERN.matcher(topicName).matches()) {
      throw new IllegalArgumentException("Invalid topic name: " + topicName);
    }
    this.topicName = topicName;
    this.eventType = eventType;
    this.compacted = compacted;
  }

  public String topicName() {
    return topicName;
  }

  public String eventType() {
    return eventType;
  }

  public boolean compacted() {
    return compacted;
  }

  /** Version suffix of the topic name, e.g. {@code 1} for {@code dex.trades.recorded.v1}. */
  public int version() {
    return Integer.parseInt(topicName.substring(topicName.lastIndexOf(".v") + 2));
  }

  public NewTopic newTopic(int partitions, int replicationFactor, Duration retention) {
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1");
    }
    if (replicationFactor < 1) {
      throw new IllegalArgumentException("replicationFactor must be >= 1");
    }
    TopicBuilder builder = TopicBuilder.name(topicName).partitions(partitions).replicas(replicationFactor);
    if (compacted) {
      return builder.compact().build();
    }
    return builder
        .configs(Map.of(TopicConfig.RETENTION_MS_CONFIG, Long.toString(retention.toMillis())))
        .build();
  }
}
