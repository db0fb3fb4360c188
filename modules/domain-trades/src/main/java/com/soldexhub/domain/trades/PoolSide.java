package com.soldexhub.domain.trades;

public enum PoolSide {
  A,
  B;

  public PoolSide opposite() {
    return this == A ? B : A;
  }
}
