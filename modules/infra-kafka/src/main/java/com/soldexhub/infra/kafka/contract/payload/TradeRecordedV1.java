package com.soldexhub.infra.kafka.contract.payload;

import java.time.Instant;

/** One committed ledger row. Amounts are raw integer units; {@code priceSol} is SOL per whole token. */
public record TradeRecordedV1(
    String txid,
    long idx,
    long slot,
    Instant blockTime,
    String dex,
    String pool,
    String mint,
    int decimals,
    String trader,
    boolean buy,
    long solAmount,
    long tokenAmount,
    double priceSol) {}
