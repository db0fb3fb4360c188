package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;
import static com.soldexhub.domain.trades.DomainChecks.requireNonNegative;

import java.time.Instant;
import java.util.Objects;

/** A Pumpfun bonding curve reached its target and stopped trading. */
public record CurveCompletedEvent(
    String mint, String bondingCurve, String trader, long slot, String txid, long idx, Instant blockTime)
    implements DexEvent {
  public CurveCompletedEvent {
    requireNonBlank(mint, "mint");
    requireNonBlank(bondingCurve, "bondingCurve");
    requireNonBlank(trader, "trader");
    requireNonNegative(slot, "slot");
    requireNonBlank(txid, "txid");
    requireNonNegative(idx, "idx");
    Objects.requireNonNull(blockTime, "blockTime must not be null");
  }

  @Override
  public DexKind dexKind() {
    return DexKind.PUMPFUN;
  }

  @Override
  public String partitionKey() {
    return bondingCurve;
  }
}
