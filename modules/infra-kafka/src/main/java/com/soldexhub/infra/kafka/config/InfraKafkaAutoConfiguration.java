package com.soldexhub.infra.kafka.config;

import com.soldexhub.infra.kafka.producer.DexEventProducer;
import com.soldexhub.infra.kafka.producer.EventPublisher;
import com.soldexhub.infra.kafka.producer.KafkaEventPublisher;
import com.soldexhub.infra.kafka.serde.EventEnvelopeJsonCodec;
import com.soldexhub.infra.kafka.topics.DexTopic;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Arrays;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

/**
 * Producer side of the DEX event topics. Idempotent, acks=all producer; the worker never consumes.
 */
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration"
    })
@ConditionalOnProperty(prefix = "infra.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(InfraKafkaProperties.class)
public class InfraKafkaAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public EventEnvelopeJsonCodec eventEnvelopeJsonCodec() {
    return new EventEnvelopeJsonCodec();
  }

  @Bean
  @ConditionalOnMissingBean(name = "dexEventProducerFactory")
  public ProducerFactory<String, String> dexEventProducerFactory(InfraKafkaProperties properties) {
    InfraKafkaProperties.Producer producer = properties.getProducer();
    return new DefaultKafkaProducerFactory<>(
        Map.<String, Object>of(
            ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, String.join(",", properties.getBootstrapServers()),
            ProducerConfig.CLIENT_ID_CONFIG, producer.getClientId(),
            ProducerConfig.ACKS_CONFIG, "all",
            ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true,
            ProducerConfig.COMPRESSION_TYPE_CONFIG, producer.getCompressionType(),
            ProducerConfig.LINGER_MS_CONFIG, (int) producer.getLinger().toMillis(),
            ProducerConfig.BATCH_SIZE_CONFIG, producer.getBatchSize(),
            ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, (int) producer.getDeliveryTimeout().toMillis(),
            ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class,
            ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class));
  }

  @Bean
  @ConditionalOnMissingBean(name = "dexEventKafkaTemplate")
  public KafkaTemplate<String, String> dexEventKafkaTemplate(
      ProducerFactory<String, String> dexEventProducerFactory) {
    return new KafkaTemplate<>(dexEventProducerFactory);
  }

  @Bean
  @ConditionalOnMissingBean
  public EventPublisher eventPublisher(
      KafkaTemplate<String, String> dexEventKafkaTemplate,
      EventEnvelopeJsonCodec eventEnvelopeJsonCodec,
      ObjectProvider<MeterRegistry> meterRegistry,
      InfraKafkaProperties properties) {
    return new KafkaEventPublisher(
        dexEventKafkaTemplate,
        eventEnvelopeJsonCodec,
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new),
        properties.getProducer().getSendTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public DexEventProducer dexEventProducer(EventPublisher eventPublisher, InfraKafkaProperties properties) {
    return new DexEventProducer(eventPublisher, properties.getProducer().getClientId());
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "infra.kafka.topics",
      name = "create",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean(name = "dexEventTopics")
  public KafkaAdmin.NewTopics dexEventTopics(InfraKafkaProperties properties) {
    InfraKafkaProperties.Topics topics = properties.getTopics();
    return new KafkaAdmin.NewTopics(
        Arrays.stream(DexTopic.values())
            .map(
                topic ->
                    topic.newTopic(topics.getPartitions(), topics.getReplicationFactor(), topics.getRetention()))
            .toArray(NewTopic[]::new));
  }
}
