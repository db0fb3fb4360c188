package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.NativeMint;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.integration.solana.codec.DecodeException;
import com.soldexhub.integration.solana.rpc.SolanaTransaction;
import com.soldexhub.integration.solana.rpc.TokenBalance;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** What a decoder sees: one invocation plus the transaction around it. */
public record DecodeContext(
    SolanaTransaction transaction, ProgramInvocation invocation, Instant blockTime) {
  public DecodeContext {
    Objects.requireNonNull(transaction, "transaction must not be null");
    Objects.requireNonNull(invocation, "invocation must not be null");
    Objects.requireNonNull(blockTime, "blockTime must not be null");
  }

  public String txid() {
    return transaction.signature();
  }

  public long slot() {
    return transaction.slot();
  }

  public long idx() {
    return invocation.position();
  }

  public String requireAccount(int index, String name) {
    String account = invocation.account(index);
    if (account == null) {
      throw new DecodeException(
          name + " expected at account " + index + " but instruction has " + invocation.accounts().size());
    }
    return account;
  }

  public Optional<TokenBalance> tokenBalance(String account) {
    return transaction.tokenBalance(account);
  }

  /** Decimals of a mint as seen in any token balance of this transaction. */
  public Optional<Integer> decimalsOfMint(String mint) {
    if (NativeMint.isNative(mint)) {
      return Optional.of(NativeMint.DECIMALS);
    }
    return transaction.tokenBalances().values().stream()
        .filter(balance -> balance.mint().equals(mint))
        .map(TokenBalance::decimals)
        .findFirst();
  }

  /** Pool metadata read from the mints of the pool's two vault token accounts, if both were touched. */
  public PoolMetadata vaultHint(DexKind kind, String pool, String vaultA, String vaultB) {
    Optional<TokenBalance> a = tokenBalance(vaultA);
    Optional<TokenBalance> b = tokenBalance(vaultB);
    if (a.isEmpty() || b.isEmpty() || a.get().mint().equals(b.get().mint())) {
      return null;
    }
    return new PoolMetadata(
        pool, kind, a.get().mint(), b.get().mint(), a.get().decimals(), b.get().decimals());
  }

  /** Pool metadata for two known mints, when this transaction reveals both decimals. */
  public PoolMetadata mintHint(DexKind kind, String pool, String mintA, String mintB) {
    if (mintA == null || mintB == null || mintA.equals(mintB)) {
      return null;
    }
    Optional<Integer> decimalsA = decimalsOfMint(mintA);
    Optional<Integer> decimalsB = decimalsOfMint(mintB);
    if (decimalsA.isEmpty() || decimalsB.isEmpty()) {
      return null;
    }
    return new PoolMetadata(pool, kind, mintA, mintB, decimalsA.get(), decimalsB.get());
  }
}
