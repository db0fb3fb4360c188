package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import java.util.List;

/** Events decoded from one transaction and the number of invocations that failed to decode. */
public record DecodeResult(List<DexEvent> events, int failures) {
  public DecodeResult {
    events = events == null ? List.of() : List.copyOf(events);
    if (failures < 0) {
      throw new IllegalArgumentException("failures must be >= 0");
    }
  }

  public static DecodeResult empty() {
    return new DecodeResult(List.of(), 0);
  }
}
