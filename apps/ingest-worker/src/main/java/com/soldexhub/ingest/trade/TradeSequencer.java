package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.Trade;
import com.soldexhub.domain.trades.TradeKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Admission gate in front of the writer. Remembers the most recently committed {@code (txid, idx)} keys and
 * orders each batch by {@code (slot, idx)}.
 *
 * <p>The window is an optimisation only; the unique key on {@code trades} still absorbs anything that slips
 * through. Keys enter the window after their batch is committed, so a batch that failed can be offered again.
 */
public class TradeSequencer {
  static final Comparator<Trade> WRITE_ORDER =
      Comparator.comparingLong(Trade::slot).thenComparingLong(Trade::idx);

  private final Map<TradeKey, Boolean> recent;

  public TradeSequencer(int windowSize) {
    if (windowSize < 1) {
      throw new IllegalArgumentException("windowSize must be >= 1");
    }
    this.recent =
        new LinkedHashMap<>(16, 0.75f, true) {
          @Override
          protected boolean removeEldestEntry(Map.Entry<TradeKey, Boolean> eldest) {
            return size() > windowSize;
          }
        };
  }

  /** Drops keys already in the window or repeated within {@code batch}; the result is sorted, ties stable. */
  public synchronized List<Trade> admit(List<Trade> batch) {
    Set<TradeKey> batchKeys = new HashSet<>();
    List<Trade> admitted = new ArrayList<>(batch.size());
    for (Trade trade : batch) {
      TradeKey key = trade.key();
      if (recent.get(key) != null) {
        continue;
      }
      if (batchKeys.add(key)) {
        admitted.add(trade);
      }
    }
    admitted.sort(WRITE_ORDER);
    return admitted;
  }

  public synchronized void markCommitted(Collection<Trade> trades) {
    for (Trade trade : trades) {
      recent.put(trade.key(), Boolean.TRUE);
    }
  }

  public synchronized boolean isRecent(TradeKey key) {
    return recent.containsKey(key);
  }

  public synchronized int windowSize() {
    return recent.size();
  }
}
