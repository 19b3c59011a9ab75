package com.laddertrader.integration.nonkyc.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.laddertrader.domain.orders.OrderSide;
import com.laddertrader.domain.orders.OrderStatus;
import com.laddertrader.integration.nonkyc.ApiCredentials;
import com.laddertrader.integration.nonkyc.NonkycRequestSigner;
import com.laddertrader.integration.nonkyc.VenueOrder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class WebSocketNonkycStreamClientTest {
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private WebSocketNonkycStreamClient client;
  private MockWebServer server;

  @AfterEach
  void tearDown() throws Exception {
    if (client != null) {
      client.stop();
    }
    if (server != null) {
      server.shutdown();
    }
  }

  @Test
  void shouldKeepDispatchingAfterHandlerFailure() {
    client = client(URI.create("ws://127.0.0.1:9"), null, 3);
    List<String> handled = new ArrayList<>();
    client.registerHandler(
        "report",
        message -> {
          handled.add(message.path("params").path("id").asText());
          if ("boom".equals(message.path("params").path("id").asText())) {
            throw new IllegalStateException("handler failed");
          }
        });
    client.setDefaultHandler(message -> handled.add("default:" + message.path("channel").asText()));

    client.handleMessage("{\"method\":\"report\",\"params\":{\"id\":\"boom\"}}");
    client.handleMessage("not json");
    client.handleMessage("{\"method\":\"report\",\"params\":{\"id\":\"ok\"}}");
    client.handleMessage("{\"channel\":\"trades\",\"data\":[]}");

    assertEquals(List.of("boom", "ok", "default:trades"), handled);
    assertEquals(
        1.0d, registry.get("worker.connector.ws.handler.errors.total").counter().count());
    assertEquals(
        1.0d,
        registry
            .get("worker.connector.ws.messages.total")
            .tag("type", "parse_error")
            .counter()
            .count());
  }

  @Test
  void shouldResolveMessageTypeFromMethodThenChannel() throws Exception {
    assertEquals(
        "report",
        WebSocketNonkycStreamClient.messageType(
            objectMapper.readTree("{\"method\":\"report\",\"channel\":\"x\"}")));
    assertEquals(
        "trades", WebSocketNonkycStreamClient.messageType(objectMapper.readTree("{\"channel\":\"trades\"}")));
    assertEquals(null, WebSocketNonkycStreamClient.messageType(objectMapper.readTree("{\"id\":1}")));
  }

  @Test
  void shouldReportFatalWhenCircuitBreakerOpens() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    client = client(URI.create("ws://127.0.0.1:" + closedPort + "/"), null, 3);
    CountDownLatch fatal = new CountDownLatch(1);
    AtomicReference<String> fatalCode = new AtomicReference<>();
    List<Duration> delays = new CopyOnWriteArrayList<>();

    client.start(
        new StreamEventHandler() {
          @Override
          public void onReconnectScheduled(long reconnectAttempts, Duration delay) {
            delays.add(delay);
          }

          @Override
          public void onFatal(String errorCode, String errorMessage) {
            fatalCode.set(errorCode);
            fatal.countDown();
          }
        });

    assertTrue(fatal.await(10, TimeUnit.SECONDS));
    assertEquals("CIRCUIT_OPEN", fatalCode.get());
    assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20)), delays);
    assertEquals(2L, client.reconnectAttempts());
    assertEquals(StreamState.DISCONNECTED, client.state());
    assertFalse(client.isConnected());
  }

  @Test
  void shouldStartAgainAfterCircuitBreakerOpened() throws Exception {
    int closedPort;
    try (ServerSocket socket = new ServerSocket(0)) {
      closedPort = socket.getLocalPort();
    }
    client = client(URI.create("ws://127.0.0.1:" + closedPort + "/"), null, 3);
    CountDownLatch firstFatal = new CountDownLatch(1);
    CountDownLatch secondFatal = new CountDownLatch(2);
    List<Duration> delays = new CopyOnWriteArrayList<>();
    StreamEventHandler handler =
        new StreamEventHandler() {
          @Override
          public void onReconnectScheduled(long reconnectAttempts, Duration delay) {
            delays.add(delay);
          }

          @Override
          public void onFatal(String errorCode, String errorMessage) {
            firstFatal.countDown();
            secondFatal.countDown();
          }
        };

    client.start(handler);
    assertTrue(firstFatal.await(10, TimeUnit.SECONDS));
    client.start(handler);

    assertTrue(secondFatal.await(10, TimeUnit.SECONDS));
    assertEquals(
        List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(10), Duration.ofMillis(20)),
        delays);
    assertEquals(4L, client.reconnectAttempts());
  }

  @Test
  void shouldReconnectWhenStartedAgainAfterStop() throws Exception {
    server = new MockWebServer();
    BlockingQueue<String> received = new LinkedBlockingQueue<>();
    for (int i = 0; i < 2; i++) {
      server.enqueue(
          new MockResponse()
              .withWebSocketUpgrade(
                  new WebSocketListener() {
                    @Override
                    public void onMessage(WebSocket webSocket, String text) {
                      received.add(text);
                    }
                  }));
    }
    server.start();
    URI wsUri = URI.create(server.url("/").toString().replaceFirst("^http", "ws"));
    client = client(wsUri, null, 5);
    client.subscribe(StreamSubscription.reports());

    client.start(null);
    assertFrame(received.poll(5, TimeUnit.SECONDS), "subscribeReports");
    client.stop();
    assertEquals(StreamState.DISCONNECTED, client.state());

    client.start(null);

    assertFrame(received.poll(5, TimeUnit.SECONDS), "subscribeReports");
  }

  @Test
  void shouldLoginAndReplaySubscriptionsOnEveryConnect() throws Exception {
    server = new MockWebServer();
    BlockingQueue<String> received = new LinkedBlockingQueue<>();
    AtomicReference<WebSocket> firstServerSocket = new AtomicReference<>();
    server.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new WebSocketListener() {
                  @Override
                  public void onOpen(WebSocket webSocket, Response response) {
                    firstServerSocket.set(webSocket);
                  }

                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    received.add(text);
                  }
                }));
    server.enqueue(
        new MockResponse()
            .withWebSocketUpgrade(
                new WebSocketListener() {
                  @Override
                  public void onMessage(WebSocket webSocket, String text) {
                    received.add(text);
                    if (text.contains("subscribeReports")) {
                      webSocket.send(
                          "{\"method\":\"report\",\"params\":{\"id\":\"o-7\",\"userProvidedId\":\"ref-7\","
                              + "\"symbol\":\"BTC_USDT\",\"side\":\"buy\",\"status\":\"Filled\","
                              + "\"price\":\"88200\",\"quantity\":\"0.001\",\"executedQuantity\":\"0.001\"}}");
                    }
                  }
                }));
    server.start();
    URI wsUri = URI.create(server.url("/").toString().replaceFirst("^http", "ws"));
    client = client(wsUri, new ApiCredentials("stream-key", "stream-secret"), 5);
    client.subscribe(StreamSubscription.reports());
    BlockingQueue<VenueOrder> reports = new LinkedBlockingQueue<>();
    client.registerHandler(
        NonkycStreamReports.REPORT, message -> reports.add(NonkycStreamReports.orderReport(message)));
    CountDownLatch connectedTwice = new CountDownLatch(2);

    client.start(
        new StreamEventHandler() {
          @Override
          public void onConnected() {
            connectedTwice.countDown();
          }
        });

    assertFrame(received.poll(5, TimeUnit.SECONDS), "login");
    assertFrame(received.poll(5, TimeUnit.SECONDS), "subscribeReports");
    firstServerSocket.get().close(1001, "going away");

    assertFrame(received.poll(5, TimeUnit.SECONDS), "login");
    assertFrame(received.poll(5, TimeUnit.SECONDS), "subscribeReports");
    VenueOrder report = reports.poll(5, TimeUnit.SECONDS);
    assertNotNull(report);
    assertEquals("o-7", report.orderId());
    assertEquals("ref-7", report.clientReferenceId());
    assertEquals(OrderSide.BUY, report.side());
    assertEquals(OrderStatus.FILLED, report.status().orElseThrow());
    assertEquals(new BigDecimal("0.001"), report.executedQuantity());
    assertTrue(connectedTwice.await(5, TimeUnit.SECONDS));
    assertTrue(client.isConnected());
  }

  @Test
  void shouldBuildSubscriptionFrames() {
    Map<String, Object> orderbook = StreamSubscription.orderbook("BTC_USDT", 20).payload();

    assertEquals("subscribeOrderbook", orderbook.get("method"));
    assertEquals(Map.of("symbol", "BTC_USDT", "limit", 20), orderbook.get("params"));
    assertEquals(Map.of("symbol", "BTC_USDT"), StreamSubscription.trades("BTC_USDT").params());
    assertEquals("subscribeReports", StreamSubscription.reports().method());
    assertTrue(StreamSubscription.balances().params().isEmpty());
  }

  private void assertFrame(String frame, String method) throws Exception {
    assertNotNull(frame, "expected " + method + " frame");
    JsonNode node = objectMapper.readTree(frame);
    assertEquals(method, node.get("method").asText());
  }

  private WebSocketNonkycStreamClient client(URI uri, ApiCredentials credentials, int threshold) {
    return new WebSocketNonkycStreamClient(
        HttpClient.newHttpClient(),
        objectMapper,
        new NonkycStreamConfig(
            uri, Duration.ofSeconds(2), Duration.ofMillis(10), Duration.ofMillis(40), threshold),
        credentials,
        new NonkycRequestSigner(objectMapper),
        registry);
  }
}
