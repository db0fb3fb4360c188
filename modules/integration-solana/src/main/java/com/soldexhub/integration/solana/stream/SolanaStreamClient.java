package com.soldexhub.integration.solana.stream;

public interface SolanaStreamClient {
  void start(SolanaStreamEventHandler eventHandler);

  void stop();

  boolean isConnected();

  long reconnectAttempts();
}
