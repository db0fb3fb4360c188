package com.soldexhub.integration.solana.accounts;

import com.soldexhub.domain.trades.PoolMetadata;

/** Looks up pool metadata at the source of truth. */
@FunctionalInterface
public interface PoolMetadataFetcher {
  /**
   * @throws com.soldexhub.domain.trades.MetadataUnresolvableException when the address is not a pool of a
   *     supported dex kind
   * @throws com.soldexhub.integration.solana.rpc.SolanaRpcException when the lookup itself failed
   */
  PoolMetadata fetch(String poolAddress);
}
