package com.laddertrader.integration.nonkyc.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.laddertrader.integration.nonkyc.ApiCredentials;
import com.laddertrader.integration.nonkyc.NonkycRequestSigner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
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
 * Streaming client on the JDK WebSocket. Every (re)connect sends the login frame when credentials
 * are present and replays all registered subscriptions before frames are dispatched.
 *
 * <p>The client can be started again after {@link #stop()} or after the circuit breaker opened;
 * each start gets a fresh reconnect scheduler and a closed circuit.
 */
public class WebSocketNonkycStreamClient implements NonkycStreamClient {
  private static final Logger log = LoggerFactory.getLogger(WebSocketNonkycStreamClient.class);

  private static final String CONNECTOR_TAG_VALUE = "nonkyc";
  private static final String PARSE_ERROR_CODE = "PARSE_ERROR";
  private static final String HANDLER_ERROR_CODE = "HANDLER_ERROR";
  private static final String CIRCUIT_OPEN_CODE = "CIRCUIT_OPEN";
  private static final String IO_ERROR_CODE = "IO_ERROR";

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final NonkycStreamConfig streamConfig;
  private final ApiCredentials credentials;
  private final NonkycRequestSigner signer;
  private final MeterRegistry meterRegistry;
  private final ReconnectBackoff backoff;
  private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
  private final List<StreamSubscription> subscriptions = new CopyOnWriteArrayList<>();
  private final Map<String, StreamMessageHandler> handlers = new ConcurrentHashMap<>();
  private final AtomicReference<StreamMessageHandler> defaultHandler = new AtomicReference<>();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
  private final AtomicLong reconnectAttempts = new AtomicLong(0L);
  private final AtomicLong connectionGeneration = new AtomicLong(0L);
  private final AtomicReference<StreamEventHandler> eventHandler =
      new AtomicReference<>(StreamEventHandler.noop());
  private final AtomicReference<WebSocket> webSocketRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> reconnectTaskRef = new AtomicReference<>();
  private final AtomicInteger connectionStateGauge = new AtomicInteger(0);

  /** {@code credentials} may be null for public market-data streams. */
  public WebSocketNonkycStreamClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      NonkycStreamConfig streamConfig,
      ApiCredentials credentials,
      NonkycRequestSigner signer,
      MeterRegistry meterRegistry) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    this.streamConfig = Objects.requireNonNull(streamConfig, "streamConfig is required");
    this.credentials = credentials;
    this.signer = Objects.requireNonNull(signer, "signer is required");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry is required");
    this.backoff = streamConfig.newBackoff();
    meterRegistry.gauge(
        "worker.connector.ws.connection.state",
        List.of(Tag.of("connector", CONNECTOR_TAG_VALUE)),
        connectionStateGauge);
  }

  @Override
  public void subscribe(StreamSubscription subscription) {
    subscriptions.add(Objects.requireNonNull(subscription, "subscription is required"));
    WebSocket socket = webSocketRef.get();
    if (socket != null && state.get() == StreamState.STREAMING) {
      send(socket, subscription.payload());
    }
  }

  @Override
  public void registerHandler(String messageType, StreamMessageHandler handler) {
    if (messageType == null || messageType.isBlank()) {
      throw new IllegalArgumentException("messageType is required");
    }
    handlers.put(messageType, Objects.requireNonNull(handler, "handler is required"));
  }

  @Override
  public void setDefaultHandler(StreamMessageHandler handler) {
    defaultHandler.set(handler);
  }

  @Override
  public void start(StreamEventHandler eventHandler) {
    this.eventHandler.set(eventHandler == null ? StreamEventHandler.noop() : eventHandler);
    if (!running.compareAndSet(false, true)) {
      return;
    }
    ScheduledExecutorService previous = scheduler.getAndSet(newScheduler());
    if (previous != null) {
      previous.shutdownNow();
    }
    if (backoff.isCircuitOpen()) {
      log.info(
          "Restarting NonKYC stream after circuit breaker opened failures={}",
          backoff.consecutiveFailures());
      backoff.recordSuccess();
    }
    scheduleReconnect(Duration.ZERO);
  }

  @Override
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    connectionGeneration.incrementAndGet();
    cancelReconnect();
    WebSocket webSocket = webSocketRef.getAndSet(null);
    if (webSocket != null) {
      try {
        webSocket.sendClose(WebSocket.NORMAL_CLOSURE, "stopped").join();
      } catch (RuntimeException ex) {
        log.debug("Close frame failed, aborting socket error={}", ex.toString());
        webSocket.abort();
      }
    }
    updateState(StreamState.DISCONNECTED);
    shutdownScheduler(true);
  }

  @Override
  public StreamState state() {
    return state.get();
  }

  @Override
  public boolean isConnected() {
    return state.get() != StreamState.DISCONNECTED && state.get() != StreamState.CONNECTING;
  }

  @Override
  public long reconnectAttempts() {
    return reconnectAttempts.get();
  }

  ReconnectBackoff backoff() {
    return backoff;
  }

  private void connect() {
    if (!running.get()) {
      return;
    }
    updateState(StreamState.CONNECTING);
    try {
      log.info("Connecting NonKYC stream ws_uri={}", streamConfig.wsUri());
      httpClient
          .newWebSocketBuilder()
          .connectTimeout(streamConfig.connectTimeout())
          .buildAsync(streamConfig.wsUri(), new Listener(connectionGeneration.get()))
          .join();
    } catch (RuntimeException ex) {
      handleConnectionFailure(ex);
    }
  }

  private void handleConnectionFailure(Throwable error) {
    updateState(StreamState.DISCONNECTED);
    String code = errorCode(error);
    meterRegistry
        .counter("worker.connector.ws.errors.total", "connector", CONNECTOR_TAG_VALUE, "error", code)
        .increment();
    eventHandler.get().onError(code, sanitizeMessage(error), unwrap(error));
    scheduleNextAttempt();
  }

  private void scheduleNextAttempt() {
    if (!running.get()) {
      return;
    }
    Duration delay = backoff.recordFailure();
    if (backoff.isCircuitOpen()) {
      running.set(false);
      cancelReconnect();
      String message =
          "Stream circuit breaker opened after " + backoff.consecutiveFailures() + " failures";
      log.error("NonKYC stream giving up failures={}", backoff.consecutiveFailures());
      meterRegistry
          .counter("worker.connector.ws.circuit.open.total", "connector", CONNECTOR_TAG_VALUE)
          .increment();
      shutdownScheduler(false);
      eventHandler.get().onFatal(CIRCUIT_OPEN_CODE, message);
      return;
    }
    long attempt = reconnectAttempts.incrementAndGet();
    meterRegistry
        .counter("worker.connector.ws.reconnect.total", "connector", CONNECTOR_TAG_VALUE)
        .increment();
    log.warn("NonKYC stream reconnect scheduled attempt={} delayMs={}", attempt, delay.toMillis());
    eventHandler.get().onReconnectScheduled(attempt, delay);
    scheduleReconnect(delay);
  }

  private void scheduleReconnect(Duration delay) {
    if (!running.get()) {
      return;
    }
    cancelReconnect();
    ScheduledExecutorService executor = scheduler.get();
    if (executor == null || executor.isShutdown()) {
      return;
    }
    ScheduledFuture<?> future =
        executor.schedule(this::connect, Math.max(0L, delay.toMillis()), TimeUnit.MILLISECONDS);
    reconnectTaskRef.set(future);
  }

  private void shutdownScheduler(boolean interrupt) {
    ScheduledExecutorService executor = scheduler.get();
    if (executor == null) {
      return;
    }
    if (interrupt) {
      executor.shutdownNow();
    } else {
      executor.shutdown();
    }
  }

  private static ScheduledExecutorService newScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, "nonkyc-stream");
          thread.setDaemon(true);
          return thread;
        });
  }

  private void cancelReconnect() {
    ScheduledFuture<?> task = reconnectTaskRef.getAndSet(null);
    if (task != null) {
      task.cancel(false);
    }
  }

  private CompletableFuture<WebSocket> handshake(WebSocket webSocket) {
    CompletableFuture<WebSocket> chain = CompletableFuture.completedFuture(webSocket);
    if (credentials != null) {
      Map<String, Object> login = signer.loginPayload(credentials);
      chain =
          chain
              .thenCompose(socket -> send(socket, login))
              .thenApply(
                  socket -> {
                    updateState(StreamState.AUTHENTICATED);
                    return socket;
                  });
    }
    for (StreamSubscription subscription : subscriptions) {
      chain = chain.thenCompose(socket -> send(socket, subscription.payload()));
    }
    return chain.thenApply(
        socket -> {
          if (state.get() != StreamState.STREAMING) {
            updateState(StreamState.SUBSCRIBED);
          }
          return socket;
        });
  }

  private CompletableFuture<WebSocket> send(WebSocket webSocket, Map<String, Object> frame) {
    try {
      return webSocket.sendText(objectMapper.writeValueAsString(frame), true);
    } catch (JsonProcessingException ex) {
      return CompletableFuture.failedFuture(ex);
    }
  }

  /** Parses and dispatches one complete text frame. Never throws. */
  void handleMessage(String payload) {
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      countMessage("parse_error");
      log.warn("Skipping unparseable stream frame error={}", ex.getOriginalMessage());
      eventHandler.get().onError(PARSE_ERROR_CODE, sanitizeMessage(ex), ex);
      return;
    }
    if (state.compareAndSet(StreamState.SUBSCRIBED, StreamState.STREAMING)) {
      connectionStateGauge.set(StreamState.STREAMING.ordinal());
    }
    String type = messageType(root);
    StreamMessageHandler handler = type == null ? null : handlers.get(type);
    if (handler == null) {
      handler = defaultHandler.get();
    }
    if (handler == null) {
      countMessage("ignored");
      return;
    }
    try {
      handler.onMessage(root);
      countMessage(type == null ? "untyped" : type);
    } catch (Exception ex) {
      meterRegistry
          .counter(
              "worker.connector.ws.handler.errors.total",
              "connector",
              CONNECTOR_TAG_VALUE,
              "type",
              type == null ? "untyped" : type)
          .increment();
      log.warn("Stream handler failed type={} error={}", type, ex.toString(), ex);
      eventHandler.get().onError(HANDLER_ERROR_CODE, sanitizeMessage(ex), ex);
    }
  }

  static String messageType(JsonNode root) {
    for (String field : List.of("method", "channel")) {
      JsonNode value = root.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  private void countMessage(String type) {
    meterRegistry
        .counter(
            "worker.connector.ws.messages.total", "connector", CONNECTOR_TAG_VALUE, "type", type)
        .increment();
  }

  private void updateState(StreamState next) {
    state.set(next);
    connectionStateGauge.set(next == StreamState.DISCONNECTED ? 0 : next.ordinal());
  }

  private static String errorCode(Throwable error) {
    String simpleName = unwrap(error).getClass().getSimpleName();
    return simpleName == null || simpleName.isBlank() ? IO_ERROR_CODE : simpleName;
  }

  private static Throwable unwrap(Throwable throwable) {
    if (throwable instanceof CompletionException && throwable.getCause() != null) {
      return throwable.getCause();
    }
    return throwable;
  }

  private static String sanitizeMessage(Throwable error) {
    Throwable unwrapped = unwrap(error);
    String message = unwrapped.getMessage();
    if (message == null || message.isBlank()) {
      return unwrapped.getClass().getSimpleName();
    }
    String compact = message.replaceAll("\\s+", " ").trim();
    return compact.length() <= 300 ? compact : compact.substring(0, 300);
  }

  /** Callbacks for one connection; a listener from before the last stop only aborts. */
  private final class Listener implements WebSocket.Listener {
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final StringBuilder frameBuffer = new StringBuilder();
    private final long generation;

    private Listener(long generation) {
      this.generation = generation;
    }

    private boolean isStale() {
      return generation != connectionGeneration.get();
    }

    @Override
    public void onOpen(WebSocket webSocket) {
      if (isStale()) {
        webSocket.abort();
        return;
      }
      webSocketRef.set(webSocket);
      backoff.recordSuccess();
      meterRegistry
          .counter("worker.connector.ws.connect.total", "connector", CONNECTOR_TAG_VALUE)
          .increment();
      log.info(
          "NonKYC stream connected subscriptions={} authenticated={}",
          subscriptions.size(),
          credentials != null);
      handshake(webSocket)
          .whenComplete(
              (socket, error) -> {
                if (error != null) {
                  log.warn("Stream handshake failed error={}", sanitizeMessage(error));
                  webSocket.abort();
                  terminate(1011, "handshake_failed", error);
                  return;
                }
                eventHandler.get().onConnected();
              });
      webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
      frameBuffer.append(data);
      if (last) {
        String payload = frameBuffer.toString();
        frameBuffer.setLength(0);
        handleMessage(payload);
      }
      webSocket.request(1);
      return null;
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

    private void terminate(int statusCode, String reason, Throwable error) {
      if (!terminated.compareAndSet(false, true) || isStale()) {
        return;
      }
      WebSocket socket = webSocketRef.getAndSet(null);
      if (socket != null) {
        socket.abort();
      }
      updateState(StreamState.DISCONNECTED);
      log.warn("NonKYC stream disconnected status={} reason={}", statusCode, reason);
      eventHandler.get().onDisconnected(statusCode, reason == null ? "" : reason);
      if (error != null) {
        String code = errorCode(error);
        meterRegistry
            .counter(
                "worker.connector.ws.errors.total", "connector", CONNECTOR_TAG_VALUE, "error", code)
            .increment();
        eventHandler.get().onError(code, sanitizeMessage(error), unwrap(error));
      }
      scheduleNextAttempt();
    }
  }
}
