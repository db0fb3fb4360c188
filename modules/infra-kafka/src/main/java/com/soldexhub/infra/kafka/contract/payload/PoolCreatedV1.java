package com.soldexhub.infra.kafka.contract.payload;

public record PoolCreatedV1(
    String pool, String dex, String mintA, String mintB, int decimalsA, int decimalsB) {}
