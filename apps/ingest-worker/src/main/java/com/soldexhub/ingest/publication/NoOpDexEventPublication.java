package com.soldexhub.ingest.publication;

import com.soldexhub.domain.trades.CurveCompletedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.Trade;
import java.util.List;

public class NoOpDexEventPublication implements DexEventPublication {
  @Override
  public void tradesRecorded(List<Trade> trades) {}

  @Override
  public void poolCreated(PoolMetadata pool) {}

  @Override
  public void curveCompleted(CurveCompletedEvent event) {}
}
