package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexKind;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Fixed dispatch table from dex kind to its decoder. */
public final class DexDecoders {
  private final Map<DexKind, DexDecoder> table;

  private DexDecoders(Map<DexKind, DexDecoder> table) {
    this.table = table;
  }

  public static DexDecoders standard() {
    return of(
        List.of(
            new RaydiumAmmDecoder(),
            new PumpfunDecoder(),
            new PumpAmmDecoder(),
            new MeteoraDlmmDecoder(),
            new MeteoraDammDecoder()));
  }

  static DexDecoders of(Collection<DexDecoder> decoders) {
    Map<DexKind, DexDecoder> table = new EnumMap<>(DexKind.class);
    for (DexDecoder decoder : decoders) {
      if (table.put(decoder.kind(), decoder) != null) {
        throw new IllegalArgumentException("Duplicate decoder for " + decoder.kind());
      }
    }
    return new DexDecoders(table);
  }

  /** A table limited to {@code kinds}; invocations of other programs are ignored. */
  public DexDecoders restrictTo(Set<DexKind> kinds) {
    Map<DexKind, DexDecoder> restricted = new EnumMap<>(DexKind.class);
    table.forEach(
        (kind, decoder) -> {
          if (kinds.contains(kind)) {
            restricted.put(kind, decoder);
          }
        });
    return new DexDecoders(restricted);
  }

  public Optional<DexDecoder> forKind(DexKind kind) {
    return Optional.ofNullable(table.get(kind));
  }

  public Set<DexKind> kinds() {
    return table.isEmpty() ? Set.of() : Set.copyOf(table.keySet());
  }
}
