package com.soldexhub.ingest.publication;

import com.soldexhub.domain.trades.CurveCompletedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.Trade;
import com.soldexhub.ingest.pool.PoolRegistrationListener;
import java.util.List;

/** After-commit announcements. Implementations must not throw and must not block the caller for long. */
public interface DexEventPublication extends PoolRegistrationListener {
  void tradesRecorded(List<Trade> trades);

  void poolCreated(PoolMetadata pool);

  void curveCompleted(CurveCompletedEvent event);

  @Override
  default void onPoolRegistered(PoolMetadata pool) {
    poolCreated(pool);
  }
}
