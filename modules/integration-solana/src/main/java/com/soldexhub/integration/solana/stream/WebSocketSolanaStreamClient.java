package com.soldexhub.integration.solana.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.soldexhub.integration.solana.RetryBackoff;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solana PubSub client holding one {@code logsSubscribe} per configured program on a single socket.
 *
 * <p>Reconnects with doubling backoff; the consecutive failure count resets once a connection has stayed up
 * for {@code stableConnectionReset}. After {@code maxConsecutiveFailures} the client stops and reports a
 * fatal error to the handler.
 */
public class WebSocketSolanaStreamClient implements SolanaStreamClient {
  private static final Logger log = LoggerFactory.getLogger(WebSocketSolanaStreamClient.class);

  private static final String STREAM_TAG_VALUE = "solana-logs";
  private static final String IO_ERROR_CODE = "IO_ERROR";
  private static final String PARSE_ERROR_CODE = "PARSE_ERROR";
  private static final String SUBSCRIBE_ERROR_CODE = "SUBSCRIBE_ERROR";
  private static final String RETRIES_EXHAUSTED_CODE = "RETRIES_EXHAUSTED";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final SolanaStreamConfig config;
  private final MeterRegistry meterRegistry;
  private final RetryBackoff reconnectBackoff;
  private final ScheduledExecutorService scheduler;
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicBoolean connected = new AtomicBoolean(false);
  private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
  private final AtomicLong reconnectAttempts = new AtomicLong(0L);
  private final AtomicLong connectionCount = new AtomicLong(0L);
  private final AtomicReference<SolanaStreamEventHandler> eventHandler =
      new AtomicReference<>(SolanaStreamEventHandler.noop());
  private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> reconnectTaskRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> pingTaskRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> stableResetTaskRef = new AtomicReference<>();
  private final AtomicInteger connectionStateGauge = new AtomicInteger(0);
  private final AtomicReference<Instant> connectedAt = new AtomicReference<>();

  public WebSocketSolanaStreamClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      SolanaStreamConfig config,
      MeterRegistry meterRegistry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.config = Objects.requireNonNull(config, "config is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.reconnectBackoff =
        new RetryBackoff(config.reconnectBaseBackoff(), config.reconnectMaxBackoff(), false);
    this.scheduler =
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "solana-logs-stream");
              thread.setDaemon(true);
              return thread;
            });
    meterRegistry.gauge(
        "ingest.stream.connection.state",
        List.of(Tag.of("stream", STREAM_TAG_VALUE)),
        connectionStateGauge);
  }

  @Override
  public void start(SolanaStreamEventHandler eventHandler) {
    SolanaStreamEventHandler handler =
        eventHandler == null ? SolanaStreamEventHandler.noop() : eventHandler;
    this.eventHandler.set(handler);
    if (!running.compareAndSet(false, true)) {
      return;
    }
    scheduleReconnect(Duration.ZERO);
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    cancelTask(reconnectTaskRef);
    cancelTask(pingTaskRef);
    cancelTask(stableResetTaskRef);
    WebSocket webSocket = webSocketRef.getAndSet(null);
    if (webSocket != null) {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "stopped").get(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        webSocket.abort();
      } catch (Exception ex) {
        log.debug("Close handshake failed, aborting socket", ex);
        webSocket.abort();
      }
    }
    updateConnected(false);
    scheduler.shutdownNow();
  }

  @Override
  public boolean isConnected() {
    return connected.get();
  }

  @Override
  public long reconnectAttempts() {
    return reconnectAttempts.get();
  }

  private void connect() {
    if (!running.get()) {
      return;
    }
    try {
      log.info("Connecting Solana logs stream ws_uri={} programs={}", config.wsUri(), config.programIds().size());
      httpClient
          .newWebSocketBuilder()
          .connectTimeout(config.connectTimeout())
          .buildAsync(config.wsUri(), new Listener())
          .join();
    } catch (Exception ex) {
      handleReconnectFailure(ex);
    }
  }

  private void handleReconnectFailure(Throwable error) {
    updateConnected(false);
    String code = errorCode(error);
    SolanaStreamEventHandler handler = eventHandler.get();
    handler.onError(code, sanitizeMessage(error), unwrapCompletionException(error));
    meterRegistry
        .counter("ingest.stream.errors.total", "stream", STREAM_TAG_VALUE, "error", code)
        .increment();
    scheduleNextAttempt(error);
  }

  private void scheduleNextAttempt(Throwable lastError) {
    if (!running.get()) {
      return;
    }
    int attempt = consecutiveFailures.incrementAndGet();
    if (attempt > config.maxConsecutiveFailures()) {
      giveUp(lastError);
      return;
    }
    long reconnectCount = reconnectAttempts.incrementAndGet();
    Duration delay = reconnectBackoff.delayForAttempt(attempt);
    meterRegistry.counter("ingest.stream.reconnect.total", "stream", STREAM_TAG_VALUE).increment();
    eventHandler.get().onReconnectScheduled(reconnectCount, delay);
    scheduleReconnect(delay);
  }

  private void giveUp(Throwable lastError) {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    String message =
        "Gave up after "
            + config.maxConsecutiveFailures()
            + " consecutive connection failures"
            + (lastError == null ? "" : ": " + sanitizeMessage(lastError));
    log.error("Solana logs stream unavailable stream={} message={}", STREAM_TAG_VALUE, message);
    meterRegistry
        .counter("ingest.stream.errors.total", "stream", STREAM_TAG_VALUE, "error", RETRIES_EXHAUSTED_CODE)
        .increment();
    scheduler.shutdown();
    eventHandler.get().onFatal(RETRIES_EXHAUSTED_CODE, message, lastError);
  }

  private void scheduleReconnect(Duration delay) {
    if (!running.get()) {
      return;
    }
    cancelTask(reconnectTaskRef);
    long delayMs = Math.max(0L, delay.toMillis());
    ScheduledFuture<?> future = scheduler.schedule(this::connect, delayMs, TimeUnit.MILLISECONDS);
    reconnectTaskRef.set(future);
  }

  private void schedulePing(WebSocket webSocket) {
    cancelTask(pingTaskRef);
    long intervalMs = config.pingInterval().toMillis();
    ScheduledFuture<?> future =
        scheduler.scheduleAtFixedRate(
            () -> {
              if (!running.get() || !connected.get()) {
                return;
              }
              webSocket
                  .sendPing(ByteBuffer.allocate(0))
                  .whenComplete(
                      (ignored, error) -> {
                        if (error != null) {
                          log.warn("Solana logs stream ping failed, forcing reconnect", error);
                          webSocket.abort();
                        }
                      });
            },
            intervalMs,
            intervalMs,
            TimeUnit.MILLISECONDS);
    pingTaskRef.set(future);
  }

  private void scheduleStableReset() {
    cancelTask(stableResetTaskRef);
    long delayMs = config.stableConnectionReset().toMillis();
    ScheduledFuture<?> future =
        scheduler.schedule(
            () -> {
              if (running.get() && connected.get()) {
                consecutiveFailures.set(0);
              }
            },
            delayMs,
            TimeUnit.MILLISECONDS);
    stableResetTaskRef.set(future);
  }

  String subscribeRequest(long requestId, String programId) {
    ObjectNode request = objectMapper.createObjectNode();
    request.put("jsonrpc", "2.0");
    request.put("id", requestId);
    request.put("method", "logsSubscribe");
    ObjectNode filter = objectMapper.createObjectNode();
    filter.putArray("mentions").add(programId);
    ObjectNode options = objectMapper.createObjectNode();
    options.put("commitment", config.commitment());
    request.putArray("params").add(filter).add(options);
    return request.toString();
  }

  static LogsNotification parseLogsNotification(JsonNode params, String programId) {
    JsonNode result = params.path("result");
    JsonNode value = result.path("value");
    String signature = value.path("signature").asText("");
    if (signature.isBlank()) {
      throw new IllegalArgumentException("logsNotification missing signature");
    }
    List<String> logs = new ArrayList<>();
    for (JsonNode line : value.path("logs")) {
      logs.add(line.asText());
    }
    JsonNode err = value.path("err");
    return new LogsNotification(
        programId,
        signature,
        result.path("context").path("slot").asLong(),
        logs,
        !err.isMissingNode() && !err.isNull());
  }

  private static void cancelTask(AtomicReference<ScheduledFuture<?>> taskRef) {
    ScheduledFuture<?> task = taskRef.getAndSet(null);
    if (task != null) {
      task.cancel(false);
    }
  }

  private void updateConnected(boolean value) {
    connected.set(value);
    connectionStateGauge.set(value ? 1 : 0);
    if (value) {
      connectedAt.set(Instant.now(config.clock()));
    }
  }

  private static String errorCode(Throwable error) {
    Throwable unwrapped = unwrapCompletionException(error);
    if (unwrapped instanceof java.net.http.WebSocketHandshakeException handshake) {
      return "HTTP_" + handshake.getResponse().statusCode();
    }
    if (unwrapped instanceof IOException) {
      return IO_ERROR_CODE;
    }
    String simpleName = unwrapped.getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? IO_ERROR_CODE : simpleName;
  }

  private static Throwable unwrapCompletionException(Throwable throwable) {
    if (throwable instanceof CompletionException completionException
        && completionException.getCause() != null) {
      return completionException.getCause();
    }
    return throwable;
  }

  private static String sanitizeMessage(Throwable error) {
    Throwable unwrapped = unwrapCompletionException(error);
    String message = unwrapped.getMessage();
    if (message == null || message.isBlank()) {
      return unwrapped.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  private Duration durationSinceConnected() {
    Instant connectedInstant = connectedAt.get();
    if (connectedInstant == null) {
      return Duration.ZERO;
    }
    return Duration.between(connectedInstant, Instant.now(config.clock())).abs();
  }

  private final class Listener implements WebSocket.Listener {
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final StringBuilder frameBuffer = new StringBuilder();
    private final Map<Long, String> pendingSubscriptions = new ConcurrentHashMap<>();
    private final Map<Long, String> subscriptions = new ConcurrentHashMap<>();

    @Override
    public void onOpen(WebSocket webSocket) {
      webSocketRef.set(webSocket);
      updateConnected(true);
      schedulePing(webSocket);
      scheduleStableReset();
      eventHandler.get().onConnected(connectionCount.incrementAndGet());
      subscribeAll(webSocket);
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (!last) {
        webSocket.request(1);
        return null;
      }
      String payload = frameBuffer.toString();
      frameBuffer.setLength(0);
      CompletionStage<Void> accepted = handleMessage(webSocket, payload);
      return accepted.whenComplete((ignored, error) -> webSocket.request(1));
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
      terminate(statusCode, reason, null);
      return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
      terminate(1011, "ws_error", error);
    }

    private void subscribeAll(WebSocket webSocket) {
      CompletableFuture<WebSocket> chain = CompletableFuture.completedFuture(webSocket);
      long requestId = 1L;
      for (String programId : config.programIds()) {
        long id = requestId++;
        pendingSubscriptions.put(id, programId);
        String request = subscribeRequest(id, programId);
        chain = chain.thenCompose(socket -> socket.sendText(request, true));
      }
      chain.whenComplete(
          (ignored, error) -> {
            if (error != null) {
              log.warn("Solana logs subscribe send failed, forcing reconnect", error);
              webSocket.abort();
            }
          });
    }

    private CompletionStage<Void> handleMessage(WebSocket webSocket, String payload) {
      try {
        JsonNode root = objectMapper.readTree(payload);
        if ("logsNotification".equals(root.path("method").asText())) {
          JsonNode params = root.path("params");
          String programId = subscriptions.get(params.path("subscription").asLong(-1L));
          if (programId == null) {
            countMessage("unknown_subscription");
            return CompletableFuture.completedFuture(null);
          }
          LogsNotification notification = parseLogsNotification(params, programId);
          countMessage("logs");
          return eventHandler.get().onLogs(notification);
        }
        if (root.has("id")) {
          handleSubscribeResponse(webSocket, root);
          return CompletableFuture.completedFuture(null);
        }
        countMessage("ignored");
      } catch (Exception ex) {
        countMessage("parse_error");
        eventHandler.get().onError(PARSE_ERROR_CODE, sanitizeMessage(ex), ex);
      }
      return CompletableFuture.completedFuture(null);
    }

    private void handleSubscribeResponse(WebSocket webSocket, JsonNode root) {
      long requestId = root.path("id").asLong(-1L);
      String programId = pendingSubscriptions.remove(requestId);
      if (programId == null) {
        countMessage("ignored");
        return;
      }
      JsonNode error = root.path("error");
      if (!error.isMissingNode() && !error.isNull()) {
        countMessage("subscribe_error");
        String message = "logsSubscribe rejected program=" + programId + " error=" + error;
        eventHandler.get().onError(SUBSCRIBE_ERROR_CODE, message, null);
        webSocket.abort();
        return;
      }
      long subscriptionId = root.path("result").asLong();
      subscriptions.put(subscriptionId, programId);
      countMessage("subscribed");
      log.info(
          "Solana logs subscription active program={} subscription_id={}", programId, subscriptionId);
      eventHandler.get().onSubscribed(programId, subscriptionId);
    }

    private void countMessage(String type) {
      meterRegistry
          .counter("ingest.stream.messages.total", "stream", STREAM_TAG_VALUE, "type", type)
          .increment();
    }

    private void terminate(int statusCode, String reason, Throwable error) {
      if (!terminated.compareAndSet(false, true)) {
        return;
      }
      cancelTask(pingTaskRef);
      cancelTask(stableResetTaskRef);
      Duration connectedFor = durationSinceConnected();
      updateConnected(false);
      WebSocket socket = webSocketRef.getAndSet(null);
      if (socket != null) {
        socket.abort();
      }
      if (connectedFor.compareTo(config.stableConnectionReset()) >= 0) {
        consecutiveFailures.set(0);
      }
      eventHandler.get().onDisconnected(statusCode, reason == null ? "" : reason);
      if (error != null) {
        String code = errorCode(error);
        meterRegistry
            .counter("ingest.stream.errors.total", "stream", STREAM_TAG_VALUE, "error", code)
            .increment();
        eventHandler.get().onError(code, sanitizeMessage(error), unwrapCompletionException(error));
      }
      scheduleNextAttempt(error);
    }
  }
}
