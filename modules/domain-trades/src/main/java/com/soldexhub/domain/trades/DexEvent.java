package com.soldexhub.domain.trades;

import java.time.Instant;

/** Protocol-neutral event decoded from one program invocation. */
public interface DexEvent {
  DexKind dexKind();

  /** Address used to partition processing; events for the same value are handled in order. */
  String partitionKey();

  long slot();

  String txid();

  long idx();

  Instant blockTime();
}
