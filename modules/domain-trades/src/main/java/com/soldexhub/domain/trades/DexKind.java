package com.soldexhub.domain.trades;

import java.util.Optional;

/** Closed set of supported exchange programs. The storage name is what lands in the {@code dex} columns. */
public enum DexKind {
  RAYDIUM_AMM("675kPX9MHTjS2zt1qfr1NYHuzeLXfQM9H24wFSUt1Mp8", "RaydiumAmm"),
  PUMPFUN("6EF8rrecthR5Dkzon8Nwu78hRvfCKubJ14M5uBEwF6P", "Pumpfun"),
  PUMP_AMM("pAMMBay6oceH9fJKBRHGP5D4bD4sWpmSwMn52FMfXEA", "PumpAmm"),
  METEORA_DLMM("LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo", "MeteoraDlmm"),
  METEORA_DAMM("Eo7WjKq67rjJQSZxS6z3YkapzY3eMj6Xy8X5EQVn5UaB", "MeteoraDamm");

  private final String programId;
  private final String storageName;

  DexKind(String programId, String storageName) {
    this.programId = programId;
    this.storageName = storageName;
  }

  public String programId() {
    return programId;
  }

  public String storageName() {
    return storageName;
  }

  public static Optional<DexKind> fromProgramId(String programId) {
    if (programId == null) {
      return Optional.empty();
    }
    for (DexKind kind : values()) {
      if (kind.programId.equals(programId)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  public static DexKind fromStorageName(String storageName) {
    for (DexKind kind : values()) {
      if (kind.storageName.equals(storageName)) {
        return kind;
      }
    }
    throw new TradeDomainException("Unknown dex: " + storageName);
  }
}
