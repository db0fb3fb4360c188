package com.soldexhub.integration.solana.rpc;

import java.util.List;
import java.util.Optional;

public interface SolanaRpcClient {
  Optional<SolanaTransaction> getTransaction(String signature);

  Optional<AccountInfo> getAccountInfo(String address);

  /** Result has the same size and order as {@code addresses}; missing accounts are empty. */
  List<Optional<AccountInfo>> getMultipleAccounts(List<String> addresses);

  /** Newest first. {@code until} and {@code before} may be {@code null}. */
  List<SignatureInfo> getSignaturesForAddress(String address, String until, String before, int limit);
}
