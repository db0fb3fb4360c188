package com.soldexhub.domain.trades;

/** The address does not resolve to a pool of any supported dex kind, or the lookup timed out. */
public class MetadataUnresolvableException extends TradeDomainException {
  private final String poolAddress;

  public MetadataUnresolvableException(String poolAddress, String message) {
    super(message);
    this.poolAddress = poolAddress;
  }

  public MetadataUnresolvableException(String poolAddress, String message, Throwable cause) {
    super(message, cause);
    this.poolAddress = poolAddress;
  }

  public String poolAddress() {
    return poolAddress;
  }
}
