package com.soldexhub.domain.trades;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Objects;

/**
 * Turns a {@link SwapEvent} and the metadata of its pool into a canonical {@link Trade}.
 *
 * <p>Direction is taken from the trader's point of view: SOL flowing into the pool is a buy of the token.
 * Amounts stay integral; the price is computed in {@link BigDecimal} and converted to {@code double} once.
 */
public class TradeNormalizer {
  private static final MathContext PRICE_CONTEXT = MathContext.DECIMAL128;

  public Trade normalize(SwapEvent event, PoolMetadata pool) {
    Objects.requireNonNull(event, "event must not be null");
    Objects.requireNonNull(pool, "pool must not be null");
    if (!event.poolAddress().equals(pool.address())) {
      throw new InconsistentPoolException(
          event.poolAddress(), "event pool " + event.poolAddress() + " resolved to " + pool.address());
    }
    PoolSide inSide = resolveInSide(event, pool);
    PoolSide nativeSide =
        pool.nativeSide()
            .orElseThrow(
                () ->
                    new TradeRejectedException(
                        TradeRejectedException.Reason.NON_NATIVE_PAIR,
                        "pool " + pool.address() + " has no SOL side"));
    PoolSide tokenSide = nativeSide.opposite();

    boolean buy = inSide == nativeSide;
    long solAmount = buy ? event.rawInAmount() : event.rawOutAmount();
    long tokenAmount = buy ? event.rawOutAmount() : event.rawInAmount();
    if (solAmount == 0 || tokenAmount == 0) {
      throw new TradeRejectedException(
          TradeRejectedException.Reason.ZERO_AMOUNT,
          "zero amount txid=" + event.txid() + " idx=" + event.idx());
    }
    int tokenDecimals = pool.decimalsOf(tokenSide);
    return new Trade(
        event.blockTime(),
        event.slot(),
        event.txid(),
        event.idx(),
        pool.mintOf(tokenSide),
        tokenDecimals,
        event.trader(),
        pool.dexKind(),
        pool.address(),
        buy,
        solAmount,
        tokenAmount,
        priceSol(solAmount, tokenAmount, tokenDecimals));
  }

  /** SOL per whole token: {@code (sol / 10^9) / (token / 10^tokenDecimals)}. */
  public static double priceSol(long solAmount, long tokenAmount, int tokenDecimals) {
    if (tokenAmount <= 0) {
      throw new TradeDomainException("tokenAmount must be > 0");
    }
    BigDecimal sol = BigDecimal.valueOf(solAmount).movePointLeft(NativeMint.DECIMALS);
    BigDecimal token = BigDecimal.valueOf(tokenAmount).movePointLeft(tokenDecimals);
    return sol.divide(token, PRICE_CONTEXT).doubleValue();
  }

  private static PoolSide resolveInSide(SwapEvent event, PoolMetadata pool) {
    if (event.inMint() == null || event.inMint().isBlank()) {
      return event.inSide();
    }
    PoolSide mintSide =
        pool.sideOfMint(event.inMint())
            .orElseThrow(
                () ->
                    new InconsistentPoolException(
                        pool.address(),
                        "mint " + event.inMint() + " is on neither side of pool " + pool.address()));
    if (event.inSide() != null && event.inSide() != mintSide) {
      throw new InconsistentPoolException(
          pool.address(),
          "input side " + event.inSide() + " disagrees with mint " + event.inMint());
    }
    return mintSide;
  }
}
