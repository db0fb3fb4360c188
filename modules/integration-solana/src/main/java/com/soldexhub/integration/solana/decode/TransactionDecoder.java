package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.integration.solana.rpc.SolanaTransaction;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a hydrated transaction and runs the matching decoder on every supported invocation. A failing
 * invocation is counted under {@code ingest.decode.errors.total} and skipped; the rest of the transaction is
 * still decoded.
 */
public class TransactionDecoder {
  private static final Logger log = LoggerFactory.getLogger(TransactionDecoder.class);

  private final DexDecoders decoders;
  private final MeterRegistry meterRegistry;

  public TransactionDecoder(DexDecoders decoders, MeterRegistry meterRegistry) {
    this.decoders = Objects.requireNonNull(decoders, "decoders must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
  }

  public DecodeResult decode(SolanaTransaction transaction, Instant fallbackBlockTime) {
    if (transaction.failed()) {
      return DecodeResult.empty();
    }
    Instant blockTime = transaction.blockTime() == null ? fallbackBlockTime : transaction.blockTime();
    List<DexEvent> events = new ArrayList<>();
    int failures = 0;
    for (ProgramInvocation invocation : InvocationWalker.walk(transaction)) {
      Optional<DexKind> kind = DexKind.fromProgramId(invocation.programId());
      if (kind.isEmpty()) {
        continue;
      }
      Optional<DexDecoder> decoder = decoders.forKind(kind.get());
      if (decoder.isEmpty()) {
        continue;
      }
      try {
        events.addAll(decoder.get().decode(new DecodeContext(transaction, invocation, blockTime)));
      } catch (RuntimeException ex) {
        failures++;
        meterRegistry
            .counter("ingest.decode.errors.total", "dex", kind.get().storageName())
            .increment();
        log.debug(
            "Decode failed dex={} txid={} position={} reason={}",
            kind.get().storageName(),
            transaction.signature(),
            invocation.position(),
            ex.getMessage());
      }
    }
    return new DecodeResult(events, failures);
  }
}
