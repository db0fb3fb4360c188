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

/** Pump AMM. Side A is the base mint, side B the quote mint. */
class PumpAmmDecoder implements DexDecoder {
  static final String CREATE_POOL = "b1310cd2a076a774";
  static final String BUY = "67f4521f2cf57777";
  static final String SELL = "3e2f370aa503dc2a";

  private static final int BASE_MINT_ACCOUNT = 3;
  private static final int QUOTE_MINT_ACCOUNT = 4;
  private static final int POOL_BASE_VAULT_ACCOUNT = 7;
  private static final int POOL_QUOTE_VAULT_ACCOUNT = 8;

  @Override
  public DexKind kind() {
    return DexKind.PUMP_AMM;
  }

  @Override
  public List<DexEvent> decode(DecodeContext context) {
    List<DexEvent> events = new ArrayList<>();
    for (AnchorEvent event : context.invocation().anchorEvents()) {
      switch (event.discriminator()) {
        case BUY -> events.add(buy(context, event.payload()));
        case SELL -> events.add(sell(context, event.payload()));
        case CREATE_POOL -> events.add(createPool(context, event.payload()));
        default -> {
          // deposits, withdrawals, admin events
        }
      }
    }
    return events;
  }

  private SwapEvent buy(DecodeContext context, BorshReader reader) {
    reader.readI64(); // timestamp
    long baseAmountOut = reader.readU64();
    reader.readU64(); // max_quote_amount_in
    reader.skip(4 * Long.BYTES); // user and pool reserves
    reader.readU64(); // quote_amount_in
    reader.skip(4 * Long.BYTES); // lp and protocol fees
    long quoteAmountInWithLpFee = reader.readU64();
    reader.readU64(); // user_quote_amount_in
    String pool = reader.readPubkey();
    String user = reader.readPubkey();
    return swap(context, pool, user, quoteAmountInWithLpFee, baseAmountOut, PoolSide.B);
  }

  private SwapEvent sell(DecodeContext context, BorshReader reader) {
    reader.readI64(); // timestamp
    long baseAmountIn = reader.readU64();
    reader.readU64(); // min_quote_amount_out
    reader.skip(4 * Long.BYTES); // user and pool reserves
    reader.readU64(); // quote_amount_out
    reader.skip(4 * Long.BYTES); // lp and protocol fees
    reader.readU64(); // quote_amount_out_without_lp_fee
    long userQuoteAmountOut = reader.readU64();
    String pool = reader.readPubkey();
    String user = reader.readPubkey();
    return swap(context, pool, user, baseAmountIn, userQuoteAmountOut, PoolSide.A);
  }

  private SwapEvent swap(
      DecodeContext context, String pool, String user, long rawIn, long rawOut, PoolSide inSide) {
    ProgramInvocation invocation = context.invocation();
    PoolMetadata hint =
        context.vaultHint(
            kind(),
            pool,
            invocation.account(POOL_BASE_VAULT_ACCOUNT),
            invocation.account(POOL_QUOTE_VAULT_ACCOUNT));
    if (hint == null) {
      hint =
          context.mintHint(
              kind(),
              pool,
              invocation.account(BASE_MINT_ACCOUNT),
              invocation.account(QUOTE_MINT_ACCOUNT));
    }
    return new SwapEvent(
        kind(),
        pool,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        user,
        rawIn,
        rawOut,
        inSide,
        null,
        hint);
  }

  private PoolCreatedEvent createPool(DecodeContext context, BorshReader reader) {
    reader.readI64(); // timestamp
    reader.readU16(); // index
    String creator = reader.readPubkey();
    String baseMint = reader.readPubkey();
    String quoteMint = reader.readPubkey();
    int baseDecimals = reader.readU8();
    int quoteDecimals = reader.readU8();
    reader.skip(7 * Long.BYTES); // amounts and liquidity
    reader.readU8(); // pool_bump
    String pool = reader.readPubkey();
    return new PoolCreatedEvent(
        new PoolMetadata(pool, kind(), baseMint, quoteMint, baseDecimals, quoteDecimals),
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        creator);
  }
}
