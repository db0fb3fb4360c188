package com.soldexhub.integration.solana.rpc;

/**
 * Failure talking to a Solana node. {@code httpStatus} is {@code -1} for transport failures, {@code rpcCode}
 * is the JSON-RPC error code when the node answered with an error object.
 */
public class SolanaRpcException extends RuntimeException {
  private static final int NODE_UNHEALTHY = -32005;
  private static final int BLOCK_NOT_AVAILABLE = -32004;
  private static final int SLOT_SKIPPED_OR_MISSING = -32007;

  private final int httpStatus;
  private final Integer rpcCode;

  public SolanaRpcException(String message, int httpStatus, Integer rpcCode, Throwable cause) {
    super(message, cause);
    this.httpStatus = httpStatus;
    this.rpcCode = rpcCode;
  }

  public SolanaRpcException(String message, int httpStatus, Integer rpcCode) {
    super(message);
    this.httpStatus = httpStatus;
    this.rpcCode = rpcCode;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public Integer rpcCode() {
    return rpcCode;
  }

  public boolean isRetryable() {
    if (httpStatus < 0 || httpStatus == 429 || httpStatus >= 500) {
      return true;
    }
    return rpcCode != null
        && (rpcCode == NODE_UNHEALTHY
            || rpcCode == BLOCK_NOT_AVAILABLE
            || rpcCode == SLOT_SKIPPED_OR_MISSING);
  }
}
