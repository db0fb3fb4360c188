package com.soldexhub.integration.solana.rpc;

import java.util.List;
import java.util.Objects;

/**
 * An outer or inner instruction with account indexes already resolved to addresses.
 *
 * <p>{@code stackHeight} is 1 for outer instructions and grows with CPI depth.
 */
public record TransactionInstruction(
    int outerIndex, int stackHeight, String programId, List<String> accounts, byte[] data) {
  public TransactionInstruction {
    Objects.requireNonNull(programId, "programId must not be null");
    accounts = accounts == null ? List.of() : List.copyOf(accounts);
    data = data == null ? new byte[0] : data;
  }

  public String account(int index) {
    return index >= 0 && index < accounts.size() ? accounts.get(index) : null;
  }
}
