package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;
import static com.soldexhub.domain.trades.DomainChecks.requireNonNegative;

import java.time.Instant;
import java.util.Objects;

public record PoolCreatedEvent(
    PoolMetadata pool, long slot, String txid, long idx, Instant blockTime, String creator)
    implements DexEvent {
  public PoolCreatedEvent {
    Objects.requireNonNull(pool, "pool must not be null");
    requireNonNegative(slot, "slot");
    requireNonBlank(txid, "txid");
    requireNonNegative(idx, "idx");
    Objects.requireNonNull(blockTime, "blockTime must not be null");
  }

  @Override
  public DexKind dexKind() {
    return pool.dexKind();
  }

  @Override
  public String partitionKey() {
    return pool.address();
  }
}
