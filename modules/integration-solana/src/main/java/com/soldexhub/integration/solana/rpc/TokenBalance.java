package com.soldexhub.integration.solana.rpc;

import java.util.Objects;

/** Token account state recorded in transaction metadata. */
public record TokenBalance(String account, String mint, int decimals, String owner) {
  public TokenBalance {
    Objects.requireNonNull(account, "account must not be null");
    Objects.requireNonNull(mint, "mint must not be null");
  }
}
