package com.soldexhub.ingest.pool;

import com.soldexhub.domain.trades.PoolMetadata;

/** Told about pools that were stored for the first time and have a SOL side. */
@FunctionalInterface
public interface PoolRegistrationListener {
  void onPoolRegistered(PoolMetadata pool);

  static PoolRegistrationListener noop() {
    return pool -> {};
  }
}
