package jobflow.connectors.webhook;

import com.sun.net.httpserver.HttpServer;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorJson;
import jobflow.connectors.ConnectorTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookConnectorTest {

  private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T08:00:00Z"), ZoneOffset.UTC);

  record Received(String path, String method, Map<String, List<String>> headers, String body) {
    String header(String name) {
      List<String> values = headers.get(name);
      return values == null ? null : values.get(0);
    }
  }

  private HttpServer server;
  private final List<Received> received = new CopyOnWriteArrayList<>();
  private volatile int status = 200;
  private volatile String responseBody = "{\"accepted\":true}";
  private String baseUrl;

  @BeforeEach
  void startServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", exchange -> {
      String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
      received.add(new Received(exchange.getRequestURI().getPath(), exchange.getRequestMethod(),
          Map.copyOf(exchange.getRequestHeaders()), body));
      byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
      exchange.sendResponseHeaders(status, bytes.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(bytes);
      }
    });
    server.start();
    baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
  }

  @AfterEach
  void stopServer() {
    server.stop(0);
  }

  private static ConnectorConfig noRetry() {
    return ConnectorConfig.builder().maxRetries(0).timeout(Duration.ofSeconds(5)).build();
  }

  private WebhookConnector connector(WebhookConfig webhook, DeliveryTracker tracker) {
    return new WebhookConnector(noRetry(), webhook, tracker, HttpClient.newHttpClient(), CLOCK);
  }

  // ── Single delivery ──────────────────────────────────────────────

  @Test
  void postsPayloadAndParsesJsonResponse() {
    WebhookConnector connector = connector(WebhookConfig.builder(baseUrl + "/hook").build(), null);

    DeliveryResult result = connector.deliver(
        new DeliveryRequest("doc-1", Map.of("total", 42), Map.of("source", "test")));

    assertTrue(result.success());
    assertEquals(200, result.responseCode());
    assertEquals(Map.of("accepted", true), result.responseData());

    Received request = received.get(0);
    assertEquals("/hook", request.path());
    assertEquals("POST", request.method());
    assertEquals("application/json", request.header("Content-type"));
    Map<String, Object> body = ConnectorJson.parseObject(request.body());
    assertEquals("doc-1", body.get("document_id"));
    assertEquals(Map.of("total", 42), body.get("data"));
    assertEquals(Map.of("source", "test"), body.get("metadata"));
    assertEquals("2024-05-01T08:00:00Z", body.get("timestamp"));
  }

  @Test
  void nonJsonResponseKeptAsText() {
    responseBody = "thanks";
    WebhookConnector connector = connector(WebhookConfig.builder(baseUrl).build(), null);

    DeliveryResult result = connector.deliver(DeliveryRequest.of("doc-1", Map.of()));

    assertTrue(result.success());
    assertEquals(Map.of("text", "thanks"), result.responseData());
  }

  @Test
  void non2xxStatusFails() {
    status = 503;
    responseBody = "busy";
    WebhookConnector connector = connector(WebhookConfig.builder(baseUrl).build(), null);

    DeliveryResult result = connector.deliver(DeliveryRequest.of("doc-1", Map.of()));

    assertFalse(result.success());
    assertEquals(503, result.responseCode());
    assertEquals("HTTP 503", result.error());
  }

  @Test
  void connectionRefusedFailsWithoutThrowing() throws IOException {
    int port;
    try (java.net.ServerSocket socket = new java.net.ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    WebhookConnector connector = connector(WebhookConfig.builder("http://127.0.0.1:" + port).build(), null);

    DeliveryResult result = connector.deliver(DeliveryRequest.of("doc-1", Map.of()));

    assertFalse(result.success());
    assertEquals(null, result.responseCode());
  }

  // ── Authentication and signing ───────────────────────────────────

  @Test
  void sendsBearerToken() {
    connector(WebhookConfig.builder(baseUrl).bearerToken("tok").build(), null)
        .deliver(DeliveryRequest.of("doc-1", Map.of()));
    assertEquals("Bearer tok", received.get(0).header("Authorization"));
  }

  @Test
  void sendsBasicAuth() {
    connector(WebhookConfig.builder(baseUrl).basicAuth("user", "pw").build(), null)
        .deliver(DeliveryRequest.of("doc-1", Map.of()));
    String expected = "Basic " + Base64.getEncoder().encodeToString("user:pw".getBytes(StandardCharsets.UTF_8));
    assertEquals(expected, received.get(0).header("Authorization"));
  }

  @Test
  void sendsApiKeyAndCustomHeaders() {
    connector(WebhookConfig.builder(baseUrl).apiKey("k-1").header("X-Tenant", "acme").build(), null)
        .deliver(DeliveryRequest.of("doc-1", Map.of()));
    assertEquals("k-1", received.get(0).header("X-api-key"));
    assertEquals("acme", received.get(0).header("X-tenant"));
  }

  @Test
  void signsExactBodyBytes() throws Exception {
    connector(WebhookConfig.builder(baseUrl).hmacSecret("s3cret").hmacAlgorithm("SHA512").build(), null)
        .deliver(DeliveryRequest.of("doc-1", Map.of("b", 2, "a", 1)));

    Received request = received.get(0);
    Mac mac = Mac.getInstance("HmacSHA512");
    mac.init(new SecretKeySpec("s3cret".getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
    String expected = "sha512=" + HexFormat.of().formatHex(mac.doFinal(request.body().getBytes(StandardCharsets.UTF_8)));
    assertEquals(expected, request.header("X-signature"));
  }

  @Test
  void rejectsUnknownHmacAlgorithm() {
    assertThrows(IllegalArgumentException.class,
        () -> WebhookConfig.builder(baseUrl).hmacAlgorithm("md5"));
  }

  // ── Batch and tracking ───────────────────────────────────────────

  @Test
  void batchEndpointReceivesOneRequestAndSkipsDelivered() {
    DeliveryTracker tracker = ConnectorTestSupport.tracker();
    WebhookConnector connector = connector(
        WebhookConfig.builder(baseUrl + "/one").batchUrl(baseUrl + "/batch").build(), tracker);

    assertTrue(connector.deliverWithRetry("doc-1", Map.of(), Map.of()).success());
    received.clear();

    List<DeliveryResult> results = connector.deliverBatch(List.of(
        DeliveryRequest.of("doc-1", Map.of()),
        DeliveryRequest.of("doc-2", Map.of("n", 2)),
        DeliveryRequest.of("doc-3", Map.of("n", 3))));

    assertEquals(3, results.size());
    assertTrue(results.get(0).isSkipped());
    assertTrue(results.get(1).success());
    assertFalse(results.get(1).isSkipped());
    assertTrue(results.get(2).success());

    assertEquals(1, received.size());
    assertEquals("/batch", received.get(0).path());
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> batch = (List<Map<String, Object>>) ConnectorJson.parseObject(received.get(0).body()).get("batch");
    assertEquals(2, batch.size());
    assertEquals("doc-2", batch.get(0).get("document_id"));

    assertTrue(tracker.checkDelivered("doc-2", WebhookConnector.TYPE));
    assertTrue(tracker.checkDelivered("doc-3", WebhookConnector.TYPE));
  }

  @Test
  void repeatedSubjectInBatchIsSentAndRecordedOnce() {
    DeliveryTracker tracker = ConnectorTestSupport.tracker();
    WebhookConnector connector = connector(
        WebhookConfig.builder(baseUrl + "/one").batchUrl(baseUrl + "/batch").build(), tracker);

    List<DeliveryResult> results = connector.deliverBatch(List.of(
        DeliveryRequest.of("doc-1", Map.of("n", 1)),
        DeliveryRequest.of("doc-2", Map.of()),
        DeliveryRequest.of("doc-1", Map.of("n", 1))));

    assertEquals(3, results.size());
    assertTrue(results.get(0).success());
    assertFalse(results.get(0).isSkipped());
    assertTrue(results.get(2).isSkipped());

    assertEquals(1, received.size());
    @SuppressWarnings("unchecked")
    List<Map<String, Object>> batch = (List<Map<String, Object>>) ConnectorJson.parseObject(received.get(0).body()).get("batch");
    assertEquals(2, batch.size());
    assertEquals("doc-1", batch.get(0).get("document_id"));
    assertEquals("doc-2", batch.get(1).get("document_id"));

    assertEquals(1, tracker.getDeliveryHistory("doc-1", 10).size());
  }

  @Test
  void batchWithoutEndpointSendsOneRequestPerItem() {
    WebhookConnector connector = connector(WebhookConfig.builder(baseUrl).build(), null);

    List<DeliveryResult> results = connector.deliverBatch(List.of(
        DeliveryRequest.of("doc-1", Map.of()),
        DeliveryRequest.of("doc-2", Map.of())));

    assertEquals(2, results.size());
    assertEquals(2, received.size());
  }
}
