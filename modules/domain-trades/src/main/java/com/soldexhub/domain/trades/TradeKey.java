package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;
import static com.soldexhub.domain.trades.DomainChecks.requireNonNegative;

/** Natural key of a trade: transaction signature plus instruction index. */
public record TradeKey(String txid, long idx) {
  public TradeKey {
    requireNonBlank(txid, "txid");
    requireNonNegative(idx, "idx");
  }
}
