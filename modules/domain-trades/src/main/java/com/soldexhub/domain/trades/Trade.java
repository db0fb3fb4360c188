package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireDecimals;
import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;
import static com.soldexhub.domain.trades.DomainChecks.requireNonNegative;

import java.time.Instant;
import java.util.Objects;

/** Canonical trade ledger row. Amounts are raw integer units, price is SOL per whole token. */
public record Trade(
    Instant blockTime,
    long slot,
    String txid,
    long idx,
    String mint,
    int decimals,
    String trader,
    DexKind dexKind,
    String poolAddress,
    boolean buy,
    long solAmount,
    long tokenAmount,
    double priceSol) {
  public Trade {
    Objects.requireNonNull(blockTime, "blockTime must not be null");
    requireNonNegative(slot, "slot");
    requireNonBlank(txid, "txid");
    requireNonNegative(idx, "idx");
    requireNonBlank(mint, "mint");
    requireDecimals(decimals, "decimals");
    requireNonBlank(trader, "trader");
    Objects.requireNonNull(dexKind, "dexKind must not be null");
    requireNonBlank(poolAddress, "poolAddress");
    requireNonNegative(solAmount, "solAmount");
    requireNonNegative(tokenAmount, "tokenAmount");
    if (Double.isNaN(priceSol) || Double.isInfinite(priceSol) || priceSol < 0) {
      throw new TradeDomainException("priceSol must be a finite non-negative number");
    }
  }

  public TradeKey key() {
    return new TradeKey(txid, idx);
  }
}
