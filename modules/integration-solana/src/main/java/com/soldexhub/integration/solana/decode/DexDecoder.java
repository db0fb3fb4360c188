package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import java.util.List;

/**
 * Binary layout of one dex kind. Implementations throw {@link
 * com.soldexhub.integration.solana.codec.DecodeException} on any layout mismatch and return an empty list
 * for invocations that carry nothing of interest.
 */
public interface DexDecoder {
  DexKind kind();

  List<DexEvent> decode(DecodeContext context);
}
