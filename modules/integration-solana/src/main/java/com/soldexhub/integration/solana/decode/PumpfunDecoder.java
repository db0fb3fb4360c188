package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.CurveCompletedEvent;
import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.NativeMint;
import com.soldexhub.domain.trades.PoolCreatedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.PoolSide;
import com.soldexhub.domain.trades.SwapEvent;
import com.soldexhub.integration.solana.codec.BorshReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Pumpfun bonding curves. A curve is modelled as a pool with the token on side A and SOL on side B; curve
 * tokens always have 6 decimals.
 */
class PumpfunDecoder implements DexDecoder {
  static final String TRADE = "bddb7fd34ee661ee";
  static final String CREATE = "1b72a94ddeeb6376";
  static final String COMPLETE = "5f72619cd42e9808";

  static final int TOKEN_DECIMALS = 6;
  private static final int BONDING_CURVE_ACCOUNT = 3;

  @Override
  public DexKind kind() {
    return DexKind.PUMPFUN;
  }

  @Override
  public List<DexEvent> decode(DecodeContext context) {
    List<DexEvent> events = new ArrayList<>();
    for (AnchorEvent event : context.invocation().anchorEvents()) {
      switch (event.discriminator()) {
        case TRADE -> events.add(trade(context, event.payload()));
        case CREATE -> events.add(create(context, event.payload()));
        case COMPLETE -> events.add(complete(context, event.payload()));
        default -> {
          // parameter and fee events
        }
      }
    }
    return events;
  }

  private SwapEvent trade(DecodeContext context, BorshReader reader) {
    String mint = reader.readPubkey();
    long solAmount = reader.readU64();
    long tokenAmount = reader.readU64();
    boolean buy = reader.readBool();
    String user = reader.readPubkey();
    reader.readI64(); // timestamp
    reader.skip(4 * Long.BYTES); // virtual and real reserves
    String curve = context.requireAccount(BONDING_CURVE_ACCOUNT, "bonding_curve");
    return new SwapEvent(
        kind(),
        curve,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        user,
        buy ? solAmount : tokenAmount,
        buy ? tokenAmount : solAmount,
        buy ? PoolSide.B : PoolSide.A,
        buy ? NativeMint.ADDRESS : mint,
        curvePool(curve, mint));
  }

  private PoolCreatedEvent create(DecodeContext context, BorshReader reader) {
    reader.readString(); // name
    reader.readString(); // symbol
    reader.readString(); // uri
    String mint = reader.readPubkey();
    String curve = reader.readPubkey();
    String user = reader.readPubkey();
    return new PoolCreatedEvent(
        curvePool(curve, mint), context.slot(), context.txid(), context.idx(), context.blockTime(), user);
  }

  private CurveCompletedEvent complete(DecodeContext context, BorshReader reader) {
    String user = reader.readPubkey();
    String mint = reader.readPubkey();
    String curve = reader.readPubkey();
    reader.readI64(); // timestamp
    return new CurveCompletedEvent(
        mint, curve, user, context.slot(), context.txid(), context.idx(), context.blockTime());
  }

  private PoolMetadata curvePool(String curve, String mint) {
    return new PoolMetadata(
        curve, kind(), mint, NativeMint.ADDRESS, TOKEN_DECIMALS, NativeMint.DECIMALS);
  }
}
