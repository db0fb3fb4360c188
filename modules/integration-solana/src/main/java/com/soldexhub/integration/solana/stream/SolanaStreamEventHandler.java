package com.soldexhub.integration.solana.stream;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public interface SolanaStreamEventHandler {
  default void onConnected(long connectionCount) {}

  default void onSubscribed(String programId, long subscriptionId) {}

  default void onDisconnected(int statusCode, String reason) {}

  default void onReconnectScheduled(long reconnectAttempts, Duration delay) {}

  /**
   * Receives one notification. The next frame is not read until the returned stage completes, which is how
   * a full downstream queue pauses the socket.
   */
  default CompletionStage<Void> onLogs(LogsNotification notification) {
    return CompletableFuture.completedFuture(null);
  }

  default void onError(String errorCode, String errorMessage, Throwable error) {}

  /** Reconnecting gave up after too many consecutive failures. The client is stopped. */
  default void onFatal(String errorCode, String errorMessage, Throwable error) {}

  static SolanaStreamEventHandler noop() {
    return new SolanaStreamEventHandler() {};
  }
}
