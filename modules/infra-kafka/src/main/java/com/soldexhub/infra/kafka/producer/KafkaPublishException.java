package com.soldexhub.infra.kafka.producer;

import com.soldexhub.infra.kafka.topics.DexTopic;

public class KafkaPublishException extends RuntimeException {
  private final DexTopic topic;
  private final String key;

  public KafkaPublishException(DexTopic topic, String key, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.key = key;
  }

  public DexTopic topic() {
    return topic;
  }

  public String key() {
    return key;
  }
}
