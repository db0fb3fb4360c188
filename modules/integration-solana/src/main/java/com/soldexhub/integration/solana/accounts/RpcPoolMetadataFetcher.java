package com.soldexhub.integration.solana.accounts;

import com.soldexhub.domain.trades.MetadataUnresolvableException;
import com.soldexhub.domain.trades.NativeMint;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.integration.solana.codec.BorshReader;
import com.soldexhub.integration.solana.codec.DecodeException;
import com.soldexhub.integration.solana.rpc.AccountInfo;
import com.soldexhub.integration.solana.rpc.SolanaRpcClient;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Resolves a pool from its on-chain account: the owner picks the layout, the mint accounts give decimals. */
public class RpcPoolMetadataFetcher implements PoolMetadataFetcher {
  static final int MINT_ACCOUNT_LENGTH = 82;
  static final int MINT_DECIMALS_OFFSET = 44;

  private final SolanaRpcClient rpcClient;

  public RpcPoolMetadataFetcher(SolanaRpcClient rpcClient) {
    this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient must not be null");
  }

  @Override
  public PoolMetadata fetch(String poolAddress) {
    AccountInfo account =
        rpcClient
            .getAccountInfo(poolAddress)
            .orElseThrow(
                () -> new MetadataUnresolvableException(poolAddress, "Pool account not found"));
    PoolAccountLayout layout =
        PoolAccountLayout.forOwner(account.owner())
            .orElseThrow(
                () ->
                    new MetadataUnresolvableException(
                        poolAddress, "Account owner is not a supported pool program: " + account.owner()));
    byte[] data = account.data();
    if (data.length < layout.minLength()) {
      throw new MetadataUnresolvableException(
          poolAddress,
          "Pool account too short for " + layout.kind() + ": " + data.length + " bytes");
    }

    String mintA = layout.mintA(data);
    String mintB = layout.mintB(data);
    if (mintA.equals(mintB)) {
      throw new MetadataUnresolvableException(poolAddress, "Pool account has identical mints");
    }
    Optional<int[]> embedded = layout.embeddedDecimals(data);
    int[] decimals = embedded.isPresent() ? embedded.get() : mintDecimals(poolAddress, mintA, mintB);
    try {
      return new PoolMetadata(poolAddress, layout.kind(), mintA, mintB, decimals[0], decimals[1]);
    } catch (IllegalArgumentException ex) {
      throw new MetadataUnresolvableException(poolAddress, ex.getMessage(), ex);
    }
  }

  private int[] mintDecimals(String poolAddress, String mintA, String mintB) {
    List<String> lookup = new ArrayList<>();
    for (String mint : List.of(mintA, mintB)) {
      if (!NativeMint.isNative(mint)) {
        lookup.add(mint);
      }
    }
    List<Optional<AccountInfo>> accounts =
        lookup.isEmpty() ? List.of() : rpcClient.getMultipleAccounts(lookup);
    int[] decimals = new int[2];
    int next = 0;
    for (int i = 0; i < 2; i++) {
      String mint = i == 0 ? mintA : mintB;
      if (NativeMint.isNative(mint)) {
        decimals[i] = NativeMint.DECIMALS;
        continue;
      }
      Optional<AccountInfo> mintAccount = next < accounts.size() ? accounts.get(next) : Optional.empty();
      next++;
      decimals[i] = decimalsOf(poolAddress, mint, mintAccount);
    }
    return decimals;
  }

  private static int decimalsOf(String poolAddress, String mint, Optional<AccountInfo> mintAccount) {
    if (mintAccount.isEmpty()) {
      throw new MetadataUnresolvableException(poolAddress, "Mint account not found: " + mint);
    }
    byte[] data = mintAccount.get().data();
    if (data.length < MINT_ACCOUNT_LENGTH) {
      throw new MetadataUnresolvableException(
          poolAddress, "Mint account too short: " + mint + " " + data.length + " bytes");
    }
    try {
      return BorshReader.u8At(data, MINT_DECIMALS_OFFSET);
    } catch (DecodeException ex) {
      throw new MetadataUnresolvableException(poolAddress, "Unreadable mint account: " + mint, ex);
    }
  }
}
