package com.soldexhub.integration.solana.decode;

import com.soldexhub.domain.trades.DexEvent;
import com.soldexhub.domain.trades.DexKind;
import com.soldexhub.domain.trades.PoolCreatedEvent;
import com.soldexhub.domain.trades.PoolMetadata;
import com.soldexhub.domain.trades.PoolSide;
import com.soldexhub.domain.trades.SwapEvent;
import com.soldexhub.integration.solana.codec.BorshReader;
import com.soldexhub.integration.solana.codec.DecodeException;
import com.soldexhub.integration.solana.rpc.TokenBalance;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Meteora dynamic AMM. The swap event carries amounts only, so the input mint is read from the user's
 * source token account.
 */
class MeteoraDammDecoder implements DexDecoder {
  static final String SWAP = "516ce3becdd00ac4";
  static final String POOL_CREATED = "ca2c295868dc9d52";

  private static final int POOL_ACCOUNT = 0;
  private static final int USER_SOURCE_ACCOUNT = 1;
  private static final int USER_DESTINATION_ACCOUNT = 2;
  private static final int A_VAULT_TOKEN_ACCOUNT = 5;
  private static final int B_VAULT_TOKEN_ACCOUNT = 6;
  private static final int USER_ACCOUNT = 12;

  @Override
  public DexKind kind() {
    return DexKind.METEORA_DAMM;
  }

  @Override
  public List<DexEvent> decode(DecodeContext context) {
    List<DexEvent> events = new ArrayList<>();
    for (AnchorEvent event : context.invocation().anchorEvents()) {
      switch (event.discriminator()) {
        case SWAP -> events.add(swap(context, event.payload()));
        case POOL_CREATED -> {
          PoolCreatedEvent created = poolCreated(context, event.payload());
          if (created != null) {
            events.add(created);
          }
        }
        default -> {
          // liquidity and admin events
        }
      }
    }
    return events;
  }

  private SwapEvent swap(DecodeContext context, BorshReader reader) {
    long inAmount = reader.readU64();
    long outAmount = reader.readU64();
    reader.readU64(); // trade_fee
    long protocolFee = reader.readU64();
    reader.readU64(); // host_fee
    // the protocol fee leaves the pool again, only the rest is swapped
    long swappedIn = inAmount - protocolFee;
    if (swappedIn < 0) {
      throw new DecodeException("Protocol fee " + protocolFee + " exceeds input " + inAmount);
    }

    String pool = context.requireAccount(POOL_ACCOUNT, "pool");
    String trader = context.requireAccount(USER_ACCOUNT, "user");
    ProgramInvocation invocation = context.invocation();
    PoolMetadata hint =
        context.vaultHint(
            kind(),
            pool,
            invocation.account(A_VAULT_TOKEN_ACCOUNT),
            invocation.account(B_VAULT_TOKEN_ACCOUNT));
    String inMint = inputMint(context, hint);
    return new SwapEvent(
        kind(),
        pool,
        context.slot(),
        context.txid(),
        context.idx(),
        context.blockTime(),
        trader,
        swappedIn,
        outAmount,
        null,
        inMint,
        hint);
  }

  private String inputMint(DecodeContext context, PoolMetadata hint) {
    ProgramInvocation invocation = context.invocation();
    Optional<TokenBalance> source = context.tokenBalance(invocation.account(USER_SOURCE_ACCOUNT));
    if (source.isPresent()) {
      return source.get().mint();
    }
    Optional<TokenBalance> destination =
        context.tokenBalance(invocation.account(USER_DESTINATION_ACCOUNT));
    if (destination.isPresent() && hint != null) {
      Optional<PoolSide> outSide = hint.sideOfMint(destination.get().mint());
      if (outSide.isPresent()) {
        return hint.mintOf(outSide.get().opposite());
      }
    }
    throw new DecodeException("Cannot tell the input mint of swap in pool " + context.invocation().account(POOL_ACCOUNT));
  }

  private PoolCreatedEvent poolCreated(DecodeContext context, BorshReader reader) {
    reader.readPubkey(); // lp_mint
    String tokenA = reader.readPubkey();
    String tokenB = reader.readPubkey();
    reader.readU8(); // pool_type
    String pool = reader.readPubkey();
    PoolMetadata metadata = context.mintHint(kind(), pool, tokenA, tokenB);
    if (metadata == null) {
      return null;
    }
    return new PoolCreatedEvent(
        metadata, context.slot(), context.txid(), context.idx(), context.blockTime(), null);
  }
}
