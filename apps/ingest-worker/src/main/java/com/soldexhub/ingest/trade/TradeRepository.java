package com.soldexhub.ingest.trade;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.Trade;
import java.util.List;
import java.util.Optional;

public interface TradeRepository {
  /**
   * Inserts the batch atomically, skipping rows whose {@code (txid, idx)} already exists.
   *
   * @return the trades that were actually inserted, in input order
   */
  List<Trade> insertIgnoringConflicts(List<Trade> trades);

  /** Signature of the highest {@code (slot, idx)} trade stored for {@code dex}. */
  Optional<String> findLatestTxid(DexKind dex);
}
