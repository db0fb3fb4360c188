package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.PoolCreatedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.PoolSide;
import com.soldexhub.domain.trades.SwapEvent;
import com.soldexhub.integration.solana.codec.BorshReader;
import java.util.ArrayList;
import java.util.List;

/** Meteora DLMM. Side A is token X, side B token Y. */
class MeteoraDlmmDecoder implements DexDecoder {
  static final String SWAP = "516ce3becdd00ac4";
  static final String LB_PAIR_CREATE = "b94afc7d1bd7bc6f";

  private static final int RESERVE_X_ACCOUNT = 2;
  private static final int RESERVE_Y_ACCOUNT = 3;
  private static final int TOKEN_X_MINT_ACCOUNT = 6;
  private static final int TOKEN_Y_MINT_ACCOUNT = 7;
  private static final int USER_ACCOUNT = 10;

  @Override
  public DexKind kind() {
    return DexKind.METEORA_DLMM;
  }

  @Override
  public List<DexEvent> decode(DecodeContext context) {
    List<DexEvent> events = new ArrayList<>();
    for (AnchorEvent event : context.invocation().anchorEvents()) {
      switch (event.discriminator()) {
        case SWAP -> events.add(swap(context, event.payload()));
        case LB_PAIR_CREATE -> {
          PoolCreatedEvent created = lbPairCreate(context, event.payload());
          if (created != null) {
            events.add(created);
          }
        }
        default -> {
          // liquidity, position and fee events
        }
      }
    }
    return events;
  }

  private SwapEvent swap(DecodeContext context, BorshReader reader) {
    String lbPair = reader.readPubkey();
    String from = reader.readPubkey();
    reader.readI32(); // start_bin_id
    reader.readI32(); // end_bin_id
    long amountIn = reader.readU64();
    long amountOut = reader.readU64();
    boolean swapForY = reader.readBool();
    reader.readU64(); // fee
    reader.readU64(); // protocol_fee
    reader.readU128(); // fee_bps
    reader.readU64(); // host_fee

    ProgramInvocation invocation = context.invocation();
    PoolMetadata hint =
        context.vaultHint(
            kind(),
            lbPair,
            invocation.account(RESERVE_X_ACCOUNT),
            invocation.account(RESERVE_Y_ACCOUNT));
    if (hint == null) {
      hint =
          context.mintHint(
              kind(),
              lbPair,
              invocation.account(TOKEN_X_MINT_ACCOUNT),
              invocation.account(TOKEN_Y_MINT_ACCOUNT));
    }
    String trader = invocation.account(USER_ACCOUNT);
    return new SwapEvent(
        kind(),
        lbPair,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        trader == null ? from : trader,
        amountIn,
        amountOut,
        swapForY ? PoolSide.A : PoolSide.B,
        null,
        hint);
  }

  /** Null when the transaction does not reveal the decimals of both tokens. */
  private PoolCreatedEvent lbPairCreate(DecodeContext context, BorshReader reader) {
    String lbPair = reader.readPubkey();
    reader.readU16(); // bin_step
    String tokenX = reader.readPubkey();
    String tokenY = reader.readPubkey();
    PoolMetadata metadata = context.mintHint(kind(), lbPair, tokenX, tokenY);
    if (metadata == null) {
      return null;
    }
    return new PoolCreatedEvent(
        metadata, context.slot(), context.txid(), context.idx(), context.blockTime(), null);
  }
}
