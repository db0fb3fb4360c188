package com.soldexhub.infra.kafka.producer;

import com.soldexhub.infra.kafka.contract.EventEnvelope;
import com.soldexhub.infra.kafka.contract.EventHeaders;
import com.soldexhub.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.soldexhub.infra.kafka.topics.DexTopic;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

public class KafkaEventPublisher implements EventPublisher {
  private static final String PUBLISH_COUNTER = "dex.kafka.publish.total";
  private static final String PUBLISH_TIMER = "dex.kafka.publish.duration";

  private final KafkaTemplate<String, String> kafkaTemplate;
  private final EventEnvelopeJsonCodec codec;
  private final MeterRegistry meterRegistry;
  private final Duration sendTimeout;

  public KafkaEventPublisher(
      KafkaTemplate<String, String> kafkaTemplate,
      EventEnvelopeJsonCodec codec,
      MeterRegistry meterRegistry,
      Duration sendTimeout) {
    this.kafkaTemplate = kafkaTemplate;
    this.codec = codec;
    this.meterRegistry = meterRegistry;
    this.sendTimeout = sendTimeout == null ? Duration.ZERO : sendTimeout;
  }

  @Override
  public CompletableFuture<SendResult<String, String>> publish(
      DexTopic topic, String key, EventEnvelope<?> envelope) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("Kafka key must not be blank");
    }
    if (!topic.eventType().equals(envelope.eventType())) {
      throw new IllegalArgumentException(
          "Topic " + topic.topicName() + " does not carry eventType=" + envelope.eventType());
    }

    ProducerRecord<String, String> record =
        new ProducerRecord<>(topic.topicName(), key, codec.encode(envelope));
    writeHeaders(record.headers(), envelope);

    Timer.Sample sample = Timer.start(meterRegistry);
    CompletableFuture<SendResult<String, String>> send;
    try {
      send = kafkaTemplate.send(record);
      if (!sendTimeout.isZero() && !sendTimeout.isNegative()) {
        send = send.orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (RuntimeException ex) {
      send = CompletableFuture.failedFuture(ex);
    }

    return send.handle(
        (result, error) -> {
          if (error == null) {
            sample.stop(meterRegistry.timer(PUBLISH_TIMER, "topic", topic.topicName()));
            meterRegistry
                .counter(PUBLISH_COUNTER, "topic", topic.topicName(), "outcome", "success")
                .increment();
            return result;
          }
          Throwable cause =
              error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
          meterRegistry
              .counter(
                  PUBLISH_COUNTER,
                  "topic",
                  topic.topicName(),
                  "outcome",
                  cause instanceof TimeoutException ? "timeout" : "failure")
              .increment();
          throw new KafkaPublishException(
              topic,
              key,
              (cause instanceof TimeoutException ? "Timed out publishing to " : "Publish failed to ")
                  + topic.topicName()
                  + " key="
                  + key,
              cause);
        });
  }

  private static void writeHeaders(Headers headers, EventEnvelope<?> envelope) {
    headers.add(EventHeaders.EVENT_TYPE, utf8(envelope.eventType()));
    headers.add(EventHeaders.EVENT_VERSION, utf8(Integer.toString(envelope.eventVersion())));
    headers.add(EventHeaders.EVENT_ID, utf8(envelope.eventId().toString()));
    headers.add(EventHeaders.SOURCE, utf8(envelope.source()));
    headers.add(EventHeaders.CONTENT_TYPE, utf8(EventHeaders.JSON));
  }

  private static byte[] utf8(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
