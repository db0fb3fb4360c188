package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.domain.trades.TradeKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

public class InMemoryTradeRepository implements TradeRepository {
  private final Map<TradeKey, Trade> rows = new LinkedHashMap<>();
  public volatile Supplier<RuntimeException> failure;

  @Override
  public synchronized List<Trade> insertIgnoringConflicts(List<Trade> trades) {
    if (failure != null) {
      throw failure.get();
    }
    List<Trade> inserted = new ArrayList<>();
    for (Trade trade : trades) {
      if (rows.putIfAbsent(trade.key(), trade) == null) {
        inserted.add(trade);
      }
    }
    return inserted;
  }

  @Override
  public synchronized Optional<String> findLatestTxid(DexKind dex) {
    Trade latest = null;
    for (Trade trade : rows.values()) {
      if (trade.dexKind() != dex) {
        continue;
      }
      if (latest == null
          || trade.slot() > latest.slot()
          || (trade.slot() == latest.slot() && trade.idx() > latest.idx())) {
        latest = trade;
      }
    }
    return Optional.ofNullable(latest).map(Trade::txid);
  }

  public synchronized List<Trade> all() {
    return List.copyOf(rows.values());
  }
}
