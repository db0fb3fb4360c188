package com.soldexhub.domain.trades;

import static com.soldexhub.domain.trades.DomainChecks.requireDecimals;
import static com.soldexhub.domain.trades.DomainChecks.requireNonBlank;

import java.util.Objects;
import java.util.Optional;

/**
 * Static description of a liquidity pool. Immutable for the pool's lifetime.
 *
 * <p>Side A and side B follow each program's own ordering (coin/pc for Raydium, base/quote for Pump AMM, X/Y
 * for DLMM, token/SOL for Pumpfun bonding curves).
 */
public record PoolMetadata(
    String address, DexKind dexKind, String mintA, String mintB, int decimalsA, int decimalsB) {
  public PoolMetadata {
    requireNonBlank(address, "address");
    Objects.requireNonNull(dexKind, "dexKind must not be null");
    requireNonBlank(mintA, "mintA");
    requireNonBlank(mintB, "mintB");
    if (mintA.equals(mintB)) {
      throw new TradeDomainException("mintA and mintB must differ");
    }
    requireDecimals(decimalsA, "decimalsA");
    requireDecimals(decimalsB, "decimalsB");
  }

  public String mintOf(PoolSide side) {
    return side == PoolSide.A ? mintA : mintB;
  }

  public int decimalsOf(PoolSide side) {
    return side == PoolSide.A ? decimalsA : decimalsB;
  }

  public Optional<PoolSide> sideOfMint(String mint) {
    if (mintA.equals(mint)) {
      return Optional.of(PoolSide.A);
    }
    if (mintB.equals(mint)) {
      return Optional.of(PoolSide.B);
    }
    return Optional.empty();
  }

  public Optional<PoolSide> nativeSide() {
    return sideOfMint(NativeMint.ADDRESS);
  }
}
