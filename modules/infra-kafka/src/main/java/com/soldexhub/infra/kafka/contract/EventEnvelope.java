package com.soldexhub.infra.kafka.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Wire wrapper around every payload. {@code slot} is the chain slot of the underlying transaction and is
 * absent for events that are not tied to one, such as pool announcements.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventEnvelope<T>(
    UUID eventId, String eventType, int eventVersion, Instant publishedAt, String source, Long slot, T payload) {
  public EventEnvelope {
    Objects.requireNonNull(eventId, "eventId must not be null");
    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("eventType must not be blank");
    }
    if (eventVersion < 1) {
      throw new IllegalArgumentException("eventVersion must be >= 1");
    }
    Objects.requireNonNull(publishedAt, "publishedAt must not be null");
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("source must not be blank");
    }
    if (slot != null && slot < 0) {
      throw new IllegalArgumentException("slot must be >= 0");
    }
    Objects.requireNonNull(payload, "payload must not be null");
  }
}
