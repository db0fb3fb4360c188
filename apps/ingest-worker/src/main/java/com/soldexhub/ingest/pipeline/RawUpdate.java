package com.soldexhub.ingest.pipeline;

import com.soldexhub.integration.solana.rpc.SignatureInfo;
import com.soldexhub.integration.solana.stream.LogsNotification;
import java.time.Instant;
import java.util.Objects;

/**
 * A transaction signature waiting to be hydrated. {@code arrivalSequence} is stamped by the pipeline when the
 * update is accepted; {@code arrivedAt} stands in for a missing block time.
 */
public record RawUpdate(
    String signature,
    long slot,
    String programId,
    boolean failed,
    UpdateSource source,
    long arrivalSequence,
    Instant arrivedAt) {
  public RawUpdate {
    if (signature == null || signature.isBlank()) {
      throw new IllegalArgumentException("signature must not be blank");
    }
    Objects.requireNonNull(source, "source must not be null");
    Objects.requireNonNull(arrivedAt, "arrivedAt must not be null");
  }

  public static RawUpdate fromStream(LogsNotification notification, Instant arrivedAt) {
    return new RawUpdate(
        notification.signature(),
        notification.slot(),
        notification.programId(),
        notification.failed(),
        UpdateSource.STREAM,
        0L,
        arrivedAt);
  }

  public static RawUpdate fromBackfill(SignatureInfo signature, String programId, Instant arrivedAt) {
    return new RawUpdate(
        signature.signature(),
        signature.slot(),
        programId,
        signature.failed(),
        UpdateSource.BACKFILL,
        0L,
        arrivedAt);
  }

  RawUpdate withArrivalSequence(long sequence) {
    return new RawUpdate(signature, slot, programId, failed, source, sequence, arrivedAt);
  }
}
