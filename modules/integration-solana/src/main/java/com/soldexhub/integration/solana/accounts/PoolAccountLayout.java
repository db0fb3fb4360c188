package com.soldexhub.integration.solana.accounts;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.integration.solana.codec.BorshReader;
import java.util.Optional;

/**
 * Byte offsets of the two mints inside a pool account, per owning program. Raydium also stores both
 * decimals; the others need a mint lookup.
 */
enum PoolAccountLayout {
  RAYDIUM_AMM(DexKind.RAYDIUM_AMM, 400, 432, 752),
  PUMP_AMM(DexKind.PUMP_AMM, 43, 75, 107),
  METEORA_DLMM(DexKind.METEORA_DLMM, 88, 120, 152),
  METEORA_DAMM(DexKind.METEORA_DAMM, 40, 72, 104);

  private static final int RAYDIUM_COIN_DECIMALS_OFFSET = 32;
  private static final int RAYDIUM_PC_DECIMALS_OFFSET = 40;

  private final DexKind kind;
  private final int mintAOffset;
  private final int mintBOffset;
  private final int minLength;

  PoolAccountLayout(DexKind kind, int mintAOffset, int mintBOffset, int minLength) {
    this.kind = kind;
    this.mintAOffset = mintAOffset;
    this.mintBOffset = mintBOffset;
    this.minLength = minLength;
  }

  DexKind kind() {
    return kind;
  }

  int minLength() {
    return minLength;
  }

  String mintA(byte[] data) {
    return BorshReader.pubkeyAt(data, mintAOffset);
  }

  String mintB(byte[] data) {
    return BorshReader.pubkeyAt(data, mintBOffset);
  }

  /** Decimals embedded in the pool account itself, A then B. */
  Optional<int[]> embeddedDecimals(byte[] data) {
    if (this != RAYDIUM_AMM) {
      return Optional.empty();
    }
    return Optional.of(
        new int[] {
          (int) BorshReader.u64At(data, RAYDIUM_COIN_DECIMALS_OFFSET),
          (int) BorshReader.u64At(data, RAYDIUM_PC_DECIMALS_OFFSET)
        });
  }

  /** Pumpfun bonding curves do not store their mint, so they have no layout. */
  static Optional<PoolAccountLayout> forOwner(String owner) {
    Optional<DexKind> kind = DexKind.fromProgramId(owner);
    if (kind.isEmpty()) {
      return Optional.empty();
    }
    for (PoolAccountLayout layout : values()) {
      if (layout.kind == kind.get()) {
        return Optional.of(layout);
      }
    }
    return Optional.empty();
  }
}
