package com.soldexhub.infra.kafka.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.soldexhub.infra.kafka.contract.EventEnvelope;

/** JSON form of {@link EventEnvelope}: ISO-8601 instants, unknown fields tolerated on read. */
public class EventEnvelopeJsonCodec {
  private final ObjectMapper objectMapper;

  public EventEnvelopeJsonCodec() {
    this(defaultObjectMapper());
  }

  public EventEnvelopeJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  public String encode(EventEnvelope<?> envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot encode " + envelope.eventType() + " envelope", ex);
    }
  }

  public <T> EventEnvelope<T> decode(String json, Class<T> payloadType) {
    try {
      return objectMapper.readValue(
          json, objectMapper.getTypeFactory().constructParametricType(EventEnvelope.class, payloadType));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot decode envelope of " + payloadType.getSimpleName(), ex);
    }
  }
}
