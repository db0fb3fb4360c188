package com.soldexhub.infra.kafka.producer;

import com.soldexhub.infra.kafka.contract.EventEnvelope;
import com.soldexhub.infra.kafka.contract.payload.CurveCompletedV1;
import com.soldexhub.infra.kafka.contract.payload.PoolCreatedV1;
import com.soldexhub.infra.kafka.contract.payload.TradeRecordedV1;
import com.soldexhub.infra.kafka.topics.DexTopic;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

/**
 * Typed entry point for the committed-event topics. Trades and pools are keyed by pool address so a consumer
 * sees one pool's history in order; curve completions are keyed by mint.
 */
public class DexEventProducer {
  private final EventPublisher eventPublisher;
  private final String source;
  private final Clock clock;

  public DexEventProducer(EventPublisher eventPublisher, String source) {
    this(eventPublisher, source, Clock.systemUTC());
  }

  public DexEventProducer(EventPublisher eventPublisher, String source, Clock clock) {
    this.eventPublisher = eventPublisher;
    this.source = source;
    this.clock = clock;
  }

  public CompletableFuture<SendResult<String, String>> publishTradeRecorded(TradeRecordedV1 payload) {
    return send(DexTopic.TRADES_RECORDED, payload.pool(), payload.slot(), payload);
  }

  public CompletableFuture<SendResult<String, String>> publishPoolCreated(PoolCreatedV1 payload) {
    return send(DexTopic.POOLS_CREATED, payload.pool(), null, payload);
  }

  public CompletableFuture<SendResult<String, String>> publishCurveCompleted(CurveCompletedV1 payload) {
    return send(DexTopic.CURVES_COMPLETED, payload.mint(), payload.slot(), payload);
  }

  private CompletableFuture<SendResult<String, String>> send(
      DexTopic topic, String key, Long slot, Object payload) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException(topic.eventType() + " key must not be blank");
    }
    EventEnvelope<Object> envelope =
        new EventEnvelope<>(
            UUID.randomUUID(), topic.eventType(), topic.version(), clock.instant(), source, slot, payload);
    return eventPublisher.publish(topic, key, envelope);
  }
}
