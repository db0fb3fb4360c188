package com.soldexhub.domain.trades;

/** Wrapped SOL, the base asset every trade is priced in. */
public final class NativeMint {
  public static final String ADDRESS = "So11111111111111111111111111111111111111112";
  public static final int DECIMALS = 9;

  private NativeMint() {}

  public static boolean isNative(String mint) {
    return ADDRESS.equals(mint);
  }
}
