package com.soldexhub.ingest.trade;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.domain.trades.TradeKey;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class TradeSequencerTest {
  @Test
  void shouldOrderBySlotThenIdxKeepingArrivalOrderForTies() {
    TradeSequencer sequencer = new TradeSequencer(100);
    Trade late = trade("sig-c", 0, 12L, "trader-c");
    Trade second = trade("sig-b", 3, 11L, "trader-b");
    Trade first = trade("sig-a", 1, 11L, "trader-a");
    Trade tieOne = trade("sig-d", 1, 13L, "trader-d1");
    Trade tieTwo = trade("sig-e", 1, 13L, "trader-e");

    List<Trade> admitted = sequencer.admit(List.of(late, second, tieOne, first, tieTwo));

    assertEquals(List.of(first, second, late, tieOne, tieTwo), admitted);
  }

  @Test
  void shouldDropDuplicatesWithinBatch() {
    TradeSequencer sequencer = new TradeSequencer(100);
    Trade original = trade("sig-a", 0, 10L, "trader-a");
    Trade replay = trade("sig-a", 0, 10L, "trader-a");

    List<Trade> admitted = sequencer.admit(List.of(original, replay));

    assertEquals(1, admitted.size());
    assertSame(original, admitted.get(0));
  }

  @Test
  void shouldFilterOnlyCommittedKeys() {
    TradeSequencer sequencer = new TradeSequencer(100);
    Trade trade = trade("sig-a", 0, 10L, "trader-a");

    assertEquals(1, sequencer.admit(List.of(trade)).size());
    assertEquals(1, sequencer.admit(List.of(trade)).size());

    sequencer.markCommitted(List.of(trade));

    assertTrue(sequencer.admit(List.of(trade)).isEmpty());
    assertTrue(sequencer.isRecent(new TradeKey("sig-a", 0)));
  }

  @Test
  void shouldEvictLeastRecentlyUsedKeysBeyondWindow() {
    TradeSequencer sequencer = new TradeSequencer(2);
    Trade a = trade("sig-a", 0, 10L, "trader");
    Trade b = trade("sig-b", 0, 11L, "trader");
    Trade c = trade("sig-c", 0, 12L, "trader");

    sequencer.markCommitted(List.of(a, b, c));

    assertEquals(2, sequencer.windowSize());
    assertFalse(sequencer.isRecent(a.key()));
    assertEquals(List.of(a), sequencer.admit(List.of(a, b, c)));
  }

  @Test
  void shouldRejectEmptyWindow() {
    assertThrows(IllegalArgumentException.class, () -> new TradeSequencer(0));
  }

  static Trade trade(String txid, long idx, long slot, String trader) {
    return new Trade(
        Instant.parse("2025-03-01T10:00:00Z"),
        slot,
        txid,
        idx,
        "TokenMint1111111111111111111111111111111111",
        6,
        trader,
        DexKind.RAYDIUM_AMM,
        "Pool111111111111111111111111111111111111111",
        true,
        1_000_000_000L,
        2_000_000L,
        500.0d);
  }
}
