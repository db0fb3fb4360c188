package com.soldexhub.ingest.pool;

import com.soldexhub.domain.trades.PoolMetadata;
import java.util.List;
import java.util.Optional;

public interface PoolRepository {
  /** @return {@code true} if a new row was written, {@code false} if the address was already stored */
  boolean insertIfAbsent(PoolMetadata pool);

  Optional<PoolMetadata> findByAddress(String address);

  /** Most recently inserted pools first. */
  List<PoolMetadata> findRecent(int limit);
}
