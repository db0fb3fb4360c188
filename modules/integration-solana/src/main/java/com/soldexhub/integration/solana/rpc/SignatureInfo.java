package com.soldexhub.integration.solana.rpc;

import java.time.Instant;
import java.util.Objects;

/** One entry of {@code getSignaturesForAddress}. {@code blockTime} may be {@code null}. */
public record SignatureInfo(String signature, long slot, boolean failed, Instant blockTime) {
  public SignatureInfo {
    Objects.requireNonNull(signature, "signature must not be null");
  }
}
