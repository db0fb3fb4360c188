package com.soldexhub.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.soldexhub.infra.kafka.contract.EventEnvelope;
import com.soldexhub.infra.kafka.contract.payload.CurveCompletedV1;
import com.soldexhub.infra.kafka.contract.payload.PoolCreatedV1;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class EventEnvelopeJsonCodecTest {
  private final EventEnvelopeJsonCodec codec = new EventEnvelopeJsonCodec();

  @Test
  void shouldWriteInstantsAsIsoStringsAndReadThemBack() {
    CurveCompletedV1 payload =
        new CurveCompletedV1("mint-1", "curve-1", "user-1", 321L, "sig-1", Instant.parse("2026-02-24T12:00:00Z"));
    EventEnvelope<CurveCompletedV1> source =
        new EventEnvelope<>(
            UUID.randomUUID(),
            "CurveCompleted",
            1,
            Instant.parse("2026-02-24T12:00:01Z"),
            "sol-dex-ingest",
            321L,
            payload);

    String json = codec.encode(source);
    EventEnvelope<CurveCompletedV1> decoded = codec.decode(json, CurveCompletedV1.class);

    assertTrue(json.contains("\"publishedAt\":\"2026-02-24T12:00:01Z\""), json);
    assertEquals(source, decoded);
  }

  @Test
  void shouldOmitSlotForPoolAnnouncements() {
    EventEnvelope<PoolCreatedV1> source =
        new EventEnvelope<>(
            UUID.randomUUID(),
            "PoolCreated",
            1,
            Instant.parse("2026-02-24T12:00:01Z"),
            "sol-dex-ingest",
            null,
            new PoolCreatedV1("pool-1", "PumpAmm", "mint-1", "So11111111111111111111111111111111111111112", 6, 9));

    String json = codec.encode(source);

    assertFalse(json.contains("\"slot\""), json);
    assertNull(codec.decode(json, PoolCreatedV1.class).slot());
  }

  @Test
  void shouldIgnoreUnknownEnvelopeFields() {
    String json =
        """
        {"eventId":"5b1c3a4e-2f1d-4c1e-9f00-000000000001","eventType":"CurveCompleted",
         "eventVersion":1,"publishedAt":"2026-02-24T12:00:01Z","source":"sol-dex-ingest",
         "slot":5,"schema":"ignored",
         "payload":{"mint":"mint-1","bondingCurve":"curve-1","trader":"user-1","slot":5,
                    "txid":"sig-1","blockTime":"2026-02-24T12:00:00Z"}}
        """;

    EventEnvelope<CurveCompletedV1> decoded = codec.decode(json, CurveCompletedV1.class);

    assertEquals("curve-1", decoded.payload().bondingCurve());
    assertEquals(5L, decoded.slot());
  }
}
