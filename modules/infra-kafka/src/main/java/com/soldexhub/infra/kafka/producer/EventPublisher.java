package com.soldexhub.infra.kafka.producer;

import com.soldexhub.infra.kafka.contract.EventEnvelope;
import com.soldexhub.infra.kafka.topics.DexTopic;
import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public interface EventPublisher {
  /** Completes exceptionally with {@link KafkaPublishException} when the broker does not acknowledge. */
  CompletableFuture<SendResult<String, String>> publish(DexTopic topic, String key, EventEnvelope<?> envelope);
}
