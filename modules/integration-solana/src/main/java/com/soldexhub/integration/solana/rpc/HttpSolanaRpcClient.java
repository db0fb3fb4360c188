package com.soldexhub.integration.solana.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** JSON-RPC 2.0 over HTTP POST. Retryable failures are retried through {@link RpcRetryExecutor}. */
public class HttpSolanaRpcClient implements SolanaRpcClient {
  private static final int IO_FAILURE_STATUS = -1;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final SolanaRpcConfig config;
  private final RpcRetryExecutor retryExecutor;
  private final AtomicLong requestIds = new AtomicLong();

  public HttpSolanaRpcClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      SolanaRpcConfig config,
      RpcRetryExecutor retryExecutor) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.retryExecutor = Objects.requireNonNull(retryExecutor, "retryExecutor is required");
  }

  @Override
  public Optional<SolanaTransaction> getTransaction(String signature) {
    ObjectNode options = objectMapper.createObjectNode();
    options.put("encoding", "json");
    options.put("maxSupportedTransactionVersion", 0);
    options.put("commitment", config.commitment());
    ArrayNode params = objectMapper.createArrayNode().add(signature).add(options);

    JsonNode result = call("getTransaction", params);
    if (result.isNull() || result.isMissingNode()) {
      return Optional.empty();
    }
    return Optional.of(TransactionJsonParser.parse(result));
  }

  @Override
  public Optional<AccountInfo> getAccountInfo(String address) {
    ArrayNode params = objectMapper.createArrayNode().add(address).add(accountOptions());
    JsonNode value = call("getAccountInfo", params).path("value");
    return parseAccount(address, value);
  }

  @Override
  public List<Optional<AccountInfo>> getMultipleAccounts(List<String> addresses) {
    if (addresses.isEmpty()) {
      return List.of();
    }
    ArrayNode keys = objectMapper.createArrayNode();
    addresses.forEach(keys::add);
    ArrayNode params = objectMapper.createArrayNode().add(keys).add(accountOptions());
    JsonNode values = call("getMultipleAccounts", params).path("value");
    if (!values.isArray() || values.size() != addresses.size()) {
      throw new IllegalStateException(
          "getMultipleAccounts returned " + values.size() + " entries for " + addresses.size() + " keys");
    }
    List<Optional<AccountInfo>> accounts = new ArrayList<>(addresses.size());
    for (int i = 0; i < addresses.size(); i++) {
      accounts.add(parseAccount(addresses.get(i), values.get(i)));
    }
    return accounts;
  }

  @Override
  public List<SignatureInfo> getSignaturesForAddress(
      String address, String until, String before, int limit) {
    ObjectNode options = objectMapper.createObjectNode();
    options.put("limit", Math.max(1, Math.min(1000, limit)));
    options.put("commitment", config.commitment());
    if (until != null && !until.isBlank()) {
      options.put("until", until);
    }
    if (before != null && !before.isBlank()) {
      options.put("before", before);
    }
    ArrayNode params = objectMapper.createArrayNode().add(address).add(options);

    List<SignatureInfo> signatures = new ArrayList<>();
    for (JsonNode entry : call("getSignaturesForAddress", params)) {
      JsonNode blockTime = entry.path("blockTime");
      signatures.add(
          new SignatureInfo(
              entry.path("signature").asText(),
              entry.path("slot").asLong(),
              !entry.path("err").isNull() && !entry.path("err").isMissingNode(),
              blockTime.isNumber() ? Instant.ofEpochSecond(blockTime.asLong()) : null));
    }
    return signatures;
  }

  private ObjectNode accountOptions() {
    ObjectNode options = objectMapper.createObjectNode();
    options.put("encoding", "base64");
    options.put("commitment", config.commitment());
    return options;
  }

  private Optional<AccountInfo> parseAccount(String address, JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) {
      return Optional.empty();
    }
    byte[] data = Base64.getDecoder().decode(value.path("data").path(0).asText(""));
    return Optional.of(
        new AccountInfo(address, value.path("owner").asText(), value.path("lamports").asLong(), data));
  }

  private JsonNode call(String method, ArrayNode params) {
    return retryExecutor.execute(method, () -> callOnce(method, params));
  }

  private JsonNode callOnce(String method, ArrayNode params) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("jsonrpc", "2.0");
    body.put("id", requestIds.incrementAndGet());
    body.put("method", method);
    body.set("params", params);

    HttpRequest request =
        HttpRequest.newBuilder(config.endpoint())
            .timeout(config.timeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
            .build();
    HttpResponse<String> response = execute(request, method);
    JsonNode root = parseJson(response.body());
    JsonNode error = root.path("error");
    if (!error.isMissingNode() && !error.isNull()) {
      Integer code = error.hasNonNull("code") ? error.get("code").intValue() : null;
      throw new SolanaRpcException(
          "Solana RPC error method="
              + method
              + " code="
              + (code == null ? "null" : code)
              + " message="
              + error.path("message").asText("Unknown RPC error"),
          response.statusCode(),
          code);
    }
    return root.path("result");
  }

  private HttpResponse<String> execute(HttpRequest request, String method) {
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new SolanaRpcException(
          "Solana RPC " + method + " request was interrupted", IO_FAILURE_STATUS, null, ex);
    } catch (IOException ex) {
      throw new SolanaRpcException(
          "Failed to call Solana RPC " + method, IO_FAILURE_STATUS, null, ex);
    }

    if (response.statusCode() >= 200 && response.statusCode() < 300) {
      return response;
    }
    throw new SolanaRpcException(
        "Solana RPC HTTP error method=" + method + " status=" + response.statusCode(),
        response.statusCode(),
        null);
  }

  private JsonNode parseJson(String responseBody) {
    try {
      return objectMapper.readTree(responseBody);
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to parse Solana RPC response JSON: " + responseBody, ex);
    }
  }
}
