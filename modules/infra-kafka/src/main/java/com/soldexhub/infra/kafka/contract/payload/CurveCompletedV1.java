package com.soldexhub.infra.kafka.contract.payload;

import java.time.Instant;

public record CurveCompletedV1(
    String mint, String bondingCurve, String trader, long slot, String txid, Instant blockTime) {}
