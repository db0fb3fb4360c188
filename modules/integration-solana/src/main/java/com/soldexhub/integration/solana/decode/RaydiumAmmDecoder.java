package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.PoolCreatedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.PoolSide;
import com.soldexhub.domain.trades.SwapEvent;
import com.soldexhub.integration.solana.codec.BorshReader;
import com.soldexhub.integration.solana.codec.DecodeException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Raydium AMM v4. Amounts come from the {@code ray_log} line: a base64 blob whose first byte is the log type.
 * The pool is instruction account 1 and the trader signs last.
 */
class RaydiumAmmDecoder implements DexDecoder {
  static final String RAY_LOG_PREFIX = "ray_log: ";

  static final int LOG_INIT = 0;
  static final int LOG_DEPOSIT = 1;
  static final int LOG_WITHDRAW = 2;
  static final int LOG_SWAP_BASE_IN = 3;
  static final int LOG_SWAP_BASE_OUT = 4;

  private static final int DIRECTION_PC_TO_COIN = 1;
  private static final int DIRECTION_COIN_TO_PC = 2;
  private static final int SWAP_MIN_ACCOUNTS = 17;
  private static final int SWAP_ACCOUNTS_WITH_TARGET_ORDERS = 18;

  @Override
  public DexKind kind() {
    return DexKind.RAYDIUM_AMM;
  }

  @Override
  public List<DexEvent> decode(DecodeContext context) {
    List<DexEvent> events = new ArrayList<>();
    for (String encoded : context.invocation().programLogs(RAY_LOG_PREFIX)) {
      byte[] log;
      try {
        log = Base64.getDecoder().decode(encoded);
      } catch (IllegalArgumentException ex) {
        throw new DecodeException("Invalid base64 in ray_log", ex);
      }
      BorshReader reader = new BorshReader(log);
      int type = reader.readU8();
      switch (type) {
        case LOG_SWAP_BASE_IN -> events.add(swapBaseIn(context, reader));
        case LOG_SWAP_BASE_OUT -> events.add(swapBaseOut(context, reader));
        case LOG_INIT -> events.add(init(context, reader));
        case LOG_DEPOSIT, LOG_WITHDRAW -> {
          // liquidity changes are not trades
        }
        default -> throw new DecodeException("Unknown ray_log type " + type);
      }
    }
    return events;
  }

  private SwapEvent swapBaseIn(DecodeContext context, BorshReader reader) {
    long amountIn = reader.readU64();
    reader.readU64(); // minimum_out
    int direction = (int) reader.readU64();
    reader.readU64(); // user_source
    reader.readU64(); // pool_coin
    reader.readU64(); // pool_pc
    long outAmount = reader.readU64();
    return swap(context, amountIn, outAmount, direction);
  }

  private SwapEvent swapBaseOut(DecodeContext context, BorshReader reader) {
    reader.readU64(); // max_in
    long amountOut = reader.readU64();
    int direction = (int) reader.readU64();
    reader.readU64(); // user_source
    reader.readU64(); // pool_coin
    reader.readU64(); // pool_pc
    long deductIn = reader.readU64();
    return swap(context, deductIn, amountOut, direction);
  }

  private SwapEvent swap(DecodeContext context, long rawIn, long rawOut, int direction) {
    PoolSide inSide =
        switch (direction) {
          case DIRECTION_PC_TO_COIN -> PoolSide.B;
          case DIRECTION_COIN_TO_PC -> PoolSide.A;
          default -> throw new DecodeException("Unknown swap direction " + direction);
        };
    ProgramInvocation invocation = context.invocation();
    if (invocation.accounts().size() < SWAP_MIN_ACCOUNTS) {
      throw new DecodeException(
          "Swap expects at least " + SWAP_MIN_ACCOUNTS + " accounts, got " + invocation.accounts().size());
    }
    String pool = context.requireAccount(1, "amm");
    int vaultOffset = invocation.accounts().size() == SWAP_ACCOUNTS_WITH_TARGET_ORDERS ? 5 : 4;
    PoolMetadata hint =
        context.vaultHint(
            kind(), pool, invocation.account(vaultOffset), invocation.account(vaultOffset + 1));
    return new SwapEvent(
        kind(),
        pool,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        invocation.lastAccount(),
        rawIn,
        rawOut,
        inSide,
        null,
        hint);
  }

  private PoolCreatedEvent init(DecodeContext context, BorshReader reader) {
    reader.readU64(); // time
    int pcDecimals = reader.readU8();
    int coinDecimals = reader.readU8();
    reader.skip(4 * Long.BYTES + BorshReader.PUBKEY_LENGTH); // lot sizes, initial amounts, market
    String pool = context.requireAccount(4, "amm");
    String coinMint = context.requireAccount(8, "coin_mint");
    String pcMint = context.requireAccount(9, "pc_mint");
    PoolMetadata metadata =
        new PoolMetadata(pool, kind(), coinMint, pcMint, coinDecimals, pcDecimals);
    return new PoolCreatedEvent(
        metadata,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        context.invocation().account(17));
  }
}
