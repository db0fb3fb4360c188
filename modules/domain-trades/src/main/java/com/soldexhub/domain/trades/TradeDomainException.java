package com.soldexhub.domain.trades;

public class TradeDomainException extends RuntimeException {
  public TradeDomainException(String message) {
    super(message);
  }

  public TradeDomainException(String message, Throwable cause) {
    super(message, cause);
  }
}
