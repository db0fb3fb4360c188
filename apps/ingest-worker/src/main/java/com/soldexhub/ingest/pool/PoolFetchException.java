package com.soldexhub.ingest.pool;

/** The metadata lookup failed for a transient reason; the address is not remembered as unresolvable. */
public class PoolFetchException extends RuntimeException {
  private final String poolAddress;

  public PoolFetchException(String poolAddress, String message, Throwable cause) {
    super(message, cause);
    this.poolAddress = poolAddress;
  }

  public String poolAddress() {
    return poolAddress;
  }
}
