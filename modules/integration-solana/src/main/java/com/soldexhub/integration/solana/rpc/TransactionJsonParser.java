package com.soldexhub.integration.solana.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.soldexhub.integration.solana.codec.Base58;
import com.soldexhub.integration.solana.codec.DecodeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads the {@code json} encoding of {@code getTransaction}, including v0 lookup-table addresses. */
public final class TransactionJsonParser {
  private TransactionJsonParser() {}

  public static SolanaTransaction parse(JsonNode result) {
    JsonNode meta = result.path("meta");
    JsonNode message = result.path("transaction").path("message");
    String signature = result.path("transaction").path("signatures").path(0).asText("");
    if (signature.isBlank()) {
      throw new IllegalStateException("Transaction result missing signature");
    }

    List<String> accountKeys = new ArrayList<>();
    for (JsonNode key : message.path("accountKeys")) {
      accountKeys.add(key.isObject() ? key.path("pubkey").asText() : key.asText());
    }
    for (JsonNode key : meta.path("loadedAddresses").path("writable")) {
      accountKeys.add(key.asText());
    }
    for (JsonNode key : meta.path("loadedAddresses").path("readonly")) {
      accountKeys.add(key.asText());
    }

    Map<Integer, JsonNode> innerByOuter = new HashMap<>();
    for (JsonNode inner : meta.path("innerInstructions")) {
      innerByOuter.put(inner.path("index").asInt(), inner.path("instructions"));
    }

    List<TransactionInstruction> instructions = new ArrayList<>();
    JsonNode outerInstructions = message.path("instructions");
    for (int outer = 0; outer < outerInstructions.size(); outer++) {
      instructions.add(instruction(outerInstructions.get(outer), outer, 1, accountKeys));
      JsonNode inner = innerByOuter.get(outer);
      if (inner == null) {
        continue;
      }
      for (JsonNode innerInstruction : inner) {
        int stackHeight = innerInstruction.path("stackHeight").asInt(2);
        instructions.add(instruction(innerInstruction, outer, Math.max(2, stackHeight), accountKeys));
      }
    }

    List<String> logs = new ArrayList<>();
    for (JsonNode line : meta.path("logMessages")) {
      logs.add(line.asText());
    }

    Map<String, TokenBalance> balances = new LinkedHashMap<>();
    putBalances(meta.path("preTokenBalances"), accountKeys, balances);
    putBalances(meta.path("postTokenBalances"), accountKeys, balances);

    JsonNode blockTime = result.path("blockTime");
    return new SolanaTransaction(
        signature,
        result.path("slot").asLong(),
        blockTime.isNumber() ? Instant.ofEpochSecond(blockTime.asLong()) : null,
        !meta.path("err").isMissingNode() && !meta.path("err").isNull(),
        accountKeys,
        instructions,
        logs,
        balances);
  }

  private static TransactionInstruction instruction(
      JsonNode node, int outerIndex, int stackHeight, List<String> accountKeys) {
    String programId = key(accountKeys, node.path("programIdIndex").asInt(-1));
    List<String> accounts = new ArrayList<>();
    for (JsonNode index : node.path("accounts")) {
      accounts.add(key(accountKeys, index.asInt(-1)));
    }
    byte[] data;
    try {
      data = Base58.decode(node.path("data").asText(""));
    } catch (DecodeException ex) {
      data = new byte[0];
    }
    return new TransactionInstruction(outerIndex, stackHeight, programId, accounts, data);
  }

  private static void putBalances(
      JsonNode balances, List<String> accountKeys, Map<String, TokenBalance> target) {
    for (JsonNode balance : balances) {
      String account = key(accountKeys, balance.path("accountIndex").asInt(-1));
      String mint = balance.path("mint").asText("");
      if (mint.isBlank()) {
        continue;
      }
      target.put(
          account,
          new TokenBalance(
              account,
              mint,
              balance.path("uiTokenAmount").path("decimals").asInt(0),
              balance.path("owner").asText(null)));
    }
  }

  private static String key(List<String> accountKeys, int index) {
    if (index < 0 || index >= accountKeys.size()) {
      throw new IllegalStateException(
          "Account index " + index + " outside " + accountKeys.size() + " account keys");
    }
    return accountKeys.get(index);
  }
}
