package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;
import static com.soldexhub.domain.trades.DomainChecks.requireNonNegative;

import java.time.Instant;
import java.util.Objects;

/**
 * A single exchange against a pool, in raw integer units.
 *
 * <p>The input asset is identified by {@code inSide}, by {@code inMint}, or by both. {@code poolHint} carries
 * whatever pool metadata the decoder could read from the same transaction and may be {@code null}.
 */
public record SwapEvent(
    DexKind dexKind,
    String poolAddress,
    long slot,
    String txid,
    long idx,
    Instant blockTime,
    String trader,
    long rawInAmount,
    long rawOutAmount,
    PoolSide inSide,
    String inMint,
    PoolMetadata poolHint)
    implements DexEvent {
  public SwapEvent {
    Objects.requireNonNull(dexKind, "dexKind must not be null");
    requireNonBlank(poolAddress, "poolAddress");
    requireNonNegative(slot, "slot");
    requireNonBlank(txid, "txid");
    requireNonNegative(idx, "idx");
    Objects.requireNonNull(blockTime, "blockTime must not be null");
    requireNonBlank(trader, "trader");
    requireNonNegative(rawInAmount, "rawInAmount");
    requireNonNegative(rawOutAmount, "rawOutAmount");
    if (inSide == null && (inMint == null || inMint.isBlank())) {
      throw new TradeDomainException("inSide or inMint is required");
    }
    if (poolHint != null && !poolHint.address().equals(poolAddress)) {
      throw new TradeDomainException("poolHint must describe poolAddress");
    }
  }

  @Override
  public String partitionKey() {
    return poolAddress;
  }

  public TradeKey key() {
    return new TradeKey(txid, idx);
  }
}
