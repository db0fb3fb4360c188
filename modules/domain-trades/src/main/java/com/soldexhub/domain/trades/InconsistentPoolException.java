package com.soldexhub.domain.trades;

public class InconsistentPoolException extends TradeRejectedException {
  private final String poolAddress;

  public InconsistentPoolException(String poolAddress, String message) {
    super(Reason.INCONSISTENT_POOL, message);
    this.poolAddress = poolAddress;
  }

  public String poolAddress() {
    return poolAddress;
  }
}
