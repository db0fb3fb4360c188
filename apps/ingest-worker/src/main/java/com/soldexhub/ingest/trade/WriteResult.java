package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.Trade;
import java.util.List;

/** Outcome of one committed trade batch. Rows that hit the unique key count as duplicates. */
public record WriteResult(int attempted, List<Trade> insertedTrades) {
  public WriteResult {
    insertedTrades = insertedTrades == null ? List.of() : List.copyOf(insertedTrades);
    if (attempted < insertedTrades.size()) {
      throw new IllegalArgumentException("attempted must be >= inserted");
    }
  }

  public int inserted() {
    return insertedTrades.size();
  }

  public int duplicates() {
    return attempted - insertedTrades.size();
  }
}
