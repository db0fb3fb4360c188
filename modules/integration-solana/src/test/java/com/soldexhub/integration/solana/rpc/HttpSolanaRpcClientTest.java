package com.soldexhub.integration.solana.rpc;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.soldexhub.integration.solana.RetryBackoff;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpSolanaRpcClientTest {
  private final ObjectMapper objectMapper = new ObjectMapper();

  private MockWebServer server;
  private SimpleMeterRegistry registry;
  private HttpSolanaRpcClient client;

  @BeforeEach
  void setUp() throws Exception {
    server = new MockWebServer();
    server.start();
    registry = new SimpleMeterRegistry();

    SolanaRpcConfig config =
        new SolanaRpcConfig(
            server.url("/").uri(),
            "confirmed",
            Duration.ofSeconds(3),
            3,
            Duration.ofMillis(10),
            Duration.ofMillis(40));
    RpcRetryExecutor retryExecutor =
        new RpcRetryExecutor(
            config.maxAttempts(),
            new RetryBackoff(config.retryBaseBackoff(), config.retryMaxBackoff(), false),
            duration -> {},
            registry);
    client =
        new HttpSolanaRpcClient(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(3)).build(),
            objectMapper,
            config,
            retryExecutor);
  }

  @AfterEach
  void tearDown() throws Exception {
    server.shutdown();
  }

  @Test
  void shouldHydrateTransactionWithInnerInstructionsAndLoadedAddresses() throws Exception {
    server.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                """
                {
                  "jsonrpc": "2.0",
                  "id": 1,
                  "result": {
                    "slot": 322000123,
                    "blockTime": 1740724823,
                    "meta": {
                      "err": null,
                      "logMessages": ["Program k3 invoke [1]", "Program k3 success"],
                      "innerInstructions": [
                        {"index": 0, "instructions": [
                          {"programIdIndex": 3, "accounts": [1, 2], "data": "5", "stackHeight": 2}
                        ]}
                      ],
                      "preTokenBalances": [
                        {"accountIndex": 1, "mint": "So11111111111111111111111111111111111111112",
                         "owner": "k0", "uiTokenAmount": {"decimals": 9, "amount": "10"}}
                      ],
                      "postTokenBalances": [
                        {"accountIndex": 4, "mint": "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v",
                         "owner": "k0", "uiTokenAmount": {"decimals": 6, "amount": "20"}}
                      ],
                      "loadedAddresses": {"writable": ["w4"], "readonly": ["r5"]}
                    },
                    "transaction": {
                      "signatures": ["sig-hydrate"],
                      "message": {
                        "accountKeys": ["k0", "k1", "k2", "k3"],
                        "instructions": [{"programIdIndex": 3, "accounts": [0, 4, 5], "data": "2"}]
                      }
                    }
                  }
                }
                """));

    SolanaTransaction transaction = client.getTransaction("sig-hydrate").orElseThrow();

    assertEquals("sig-hydrate", transaction.signature());
    assertEquals(322_000_123L, transaction.slot());
    assertEquals(Instant.ofEpochSecond(1_740_724_823L), transaction.blockTime());
    assertFalse(transaction.failed());
    assertEquals(List.of("k0", "k1", "k2", "k3", "w4", "r5"), transaction.accountKeys());
    assertEquals(2, transaction.instructions().size());
    assertEquals(List.of("k0", "w4", "r5"), transaction.instructions().get(0).accounts());
    assertArrayEquals(new byte[] {1}, transaction.instructions().get(0).data());
    assertEquals(2, transaction.instructions().get(1).stackHeight());
    assertEquals(9, transaction.tokenBalance("k1").orElseThrow().decimals());
    assertEquals(6, transaction.tokenBalance("w4").orElseThrow().decimals());

    RecordedRequest recorded = server.takeRequest();
    JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
    assertEquals("POST", recorded.getMethod());
    assertEquals("getTransaction", body.path("method").asText());
    assertEquals("sig-hydrate", body.path("params").path(0).asText());
    assertEquals(0, body.path("params").path(1).path("maxSupportedTransactionVersion").asInt(-1));
    assertEquals("confirmed", body.path("params").path(1).path("commitment").asText());
  }

  @Test
  void shouldReturnEmptyForUnknownTransaction() {
    server.enqueue(new MockResponse().setBody("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"));

    assertTrue(client.getTransaction("sig-missing").isEmpty());
  }

  @Test
  void shouldRetryRateLimitedCalls() {
    server.enqueue(new MockResponse().setResponseCode(429).setBody("Too many requests"));
    server.enqueue(
        new MockResponse()
            .setBody(
                """
                {"jsonrpc":"2.0","id":2,"result":{"context":{"slot":1},
                 "value":{"data":["AQID","base64"],"owner":"LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo","lamports":7}}}
                """));

    AccountInfo account = client.getAccountInfo("pool-1").orElseThrow();

    assertEquals("LBUZKhRxPF3XUpBCjp4YzTKgLccjZhTSDM9YuVaPwxo", account.owner());
    assertArrayEquals(new byte[] {1, 2, 3}, account.data());
    assertEquals(2, server.getRequestCount());
    assertEquals(
        1.0d,
        registry.get("solana.rpc.retry.total").tag("method", "getAccountInfo").counter().count());
  }

  @Test
  void shouldSurfaceNonRetryableRpcError() {
    server.enqueue(
        new MockResponse()
            .setBody(
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32602,\"message\":\"Invalid param\"}}"));

    SolanaRpcException error =
        assertThrows(SolanaRpcException.class, () -> client.getAccountInfo("not-a-key"));

    assertEquals(Integer.valueOf(-32602), error.rpcCode());
    assertFalse(error.isRetryable());
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void shouldPageSignaturesWithUntilAnchor() throws Exception {
    server.enqueue(
        new MockResponse()
            .setBody(
                """
                {"jsonrpc":"2.0","id":1,"result":[
                  {"signature":"sig-3","slot":30,"err":null,"blockTime":1740724900},
                  {"signature":"sig-2","slot":20,"err":{"InstructionError":[0,"Custom"]},"blockTime":null}
                ]}
                """));

    List<SignatureInfo> signatures =
        client.getSignaturesForAddress("program-1", "sig-1", null, 5000);

    assertEquals(2, signatures.size());
    assertEquals("sig-3", signatures.get(0).signature());
    assertFalse(signatures.get(0).failed());
    assertTrue(signatures.get(1).failed());
    assertNull(signatures.get(1).blockTime());

    JsonNode options = objectMapper.readTree(server.takeRequest().getBody().readUtf8()).path("params").path(1);
    assertEquals("sig-1", options.path("until").asText());
    assertEquals(1000, options.path("limit").asInt());
    assertTrue(options.path("before").isMissingNode());
  }

  @Test
  void shouldKeepOrderOfMultipleAccounts() {
    server.enqueue(
        new MockResponse()
            .setBody(
                """
                {"jsonrpc":"2.0","id":1,"result":{"context":{"slot":1},"value":[
                  null,
                  {"data":["AAE=","base64"],"owner":"TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA","lamports":1}
                ]}}
                """));

    List<Optional<AccountInfo>> accounts = client.getMultipleAccounts(List.of("mint-a", "mint-b"));

    assertTrue(accounts.get(0).isEmpty());
    assertEquals("mint-b", accounts.get(1).orElseThrow().address());
  }
}
