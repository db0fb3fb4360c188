package com.soldexhub.integration.solana.rpc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A confirmed transaction as returned by {@code getTransaction}.
 *
 * <p>{@code instructions} is flattened in execution order: each outer instruction followed by its inner
 * instructions. {@code tokenBalances} is keyed by token account address and prefers post-balances.
 */
public record SolanaTransaction(
    String signature,
    long slot,
    Instant blockTime,
    boolean failed,
    List<String> accountKeys,
    List<TransactionInstruction> instructions,
    List<String> logMessages,
    Map<String, TokenBalance> tokenBalances) {
  public SolanaTransaction {
    Objects.requireNonNull(signature, "signature must not be null");
    accountKeys = accountKeys == null ? List.of() : List.copyOf(accountKeys);
    instructions = instructions == null ? List.of() : List.copyOf(instructions);
    logMessages = logMessages == null ? List.of() : List.copyOf(logMessages);
    tokenBalances = tokenBalances == null ? Map.of() : Map.copyOf(tokenBalances);
  }

  public Optional<TokenBalance> tokenBalance(String account) {
    return account == null ? Optional.empty() : Optional.ofNullable(tokenBalances.get(account));
  }
}
