package com.soldexhub.domain.trades;

import java.util.Locale;
import java.util.Objects;

/** A swap that cannot become a ledger row. The event is dropped and counted under {@link #reason()}. */
public class TradeRejectedException extends TradeDomainException {
  public enum Reason {
    INCONSISTENT_POOL,
    NON_NATIVE_PAIR,
    ZERO_AMOUNT;

    public String tag() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private final Reason reason;

  public TradeRejectedException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason, "reason must not be null");
  }

  public Reason reason() {
    return reason;
  }
}
