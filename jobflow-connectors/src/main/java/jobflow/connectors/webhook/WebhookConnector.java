package jobflow.connectors.webhook;

import jobflow.connector.AbstractConnector;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryException;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorJson;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers subjects to an HTTP endpoint.
 *
 * <p>Each request body is {@code {"document_id", "data", "metadata", "timestamp"}} as
 * JSON with sorted keys. A 2xx status is a success; anything else fails with
 * {@code HTTP <status>}. A JSON object response becomes the result's response data,
 * any other body is kept under {@code text}.
 *
 * <p>With a {@linkplain WebhookConfig#batchUrl() batch endpoint}, {@link #deliverBatch}
 * sends all not yet delivered subjects in one {@code {"batch": [...]}} request.
 */
public final class WebhookConnector extends AbstractConnector {
  private static final Logger logger = Logger.getLogger(WebhookConnector.class.getName());

  public static final String TYPE = "webhook";

  private final WebhookConfig webhook;
  private final HttpClient httpClient;
  private final Clock clock;

  public WebhookConnector(ConnectorConfig config, WebhookConfig webhook, DeliveryTracker tracker) {
    this(config, webhook, tracker,
        HttpClient.newBuilder().connectTimeout(config.timeout()).build(), Clock.systemUTC());
  }

  public WebhookConnector(ConnectorConfig config, WebhookConfig webhook, DeliveryTracker tracker,
      HttpClient httpClient, Clock clock) {
    super(config, tracker);
    this.webhook = Objects.requireNonNull(webhook, "webhook");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String connectorType() {
    return TYPE;
  }

  @Override
  public DeliveryResult deliver(DeliveryRequest request) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("document_id", request.subjectId());
    payload.put("data", request.data());
    payload.put("metadata", request.metadata());
    payload.put("timestamp", clock.instant().toString());
    return send(webhook.url(), payload);
  }

  /**
   * Sends the batch in a single request when a batch endpoint is configured,
   * otherwise one request per item. Already delivered subjects are skipped, as is
   * every repeat of a subject within the batch after its first occurrence.
   */
  @Override
  public List<DeliveryResult> deliverBatch(List<DeliveryRequest> requests) {
    if (webhook.batchUrl() == null) {
      return super.deliverBatch(requests);
    }
    Map<String, DeliveryRequest> toSend = new LinkedHashMap<>();
    for (DeliveryRequest request : requests) {
      if (!toSend.containsKey(request.subjectId()) && shouldDeliver(request.subjectId())) {
        toSend.put(request.subjectId(), request);
      }
    }
    DeliveryResult shared = null;
    if (!toSend.isEmpty()) {
      List<Map<String, Object>> items = new ArrayList<>(toSend.size());
      for (DeliveryRequest request : toSend.values()) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("document_id", request.subjectId());
        item.put("data", request.data());
        item.put("metadata", request.metadata());
        items.add(item);
      }
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("batch", items);
      payload.put("timestamp", clock.instant().toString());
      shared = send(webhook.batchUrl(), payload);
    }
    List<DeliveryResult> results = new ArrayList<>(requests.size());
    for (DeliveryRequest request : requests) {
      // only the first occurrence of a subject takes the batch outcome
      if (toSend.remove(request.subjectId()) == null) {
        results.add(DeliveryResult.skipped());
        continue;
      }
      DeliveryResult result = shared.success()
          ? DeliveryResult.delivered(Map.of(), shared.responseCode(), shared.durationMs())
          : DeliveryResult.failed(shared.error(), shared.responseCode(), shared.durationMs());
      recordOutcome(request.subjectId(), result);
      results.add(result);
    }
    return results;
  }

  private DeliveryResult send(URI target, Map<String, Object> payload) {
    long start = System.nanoTime();
    try {
      String body = ConnectorJson.toJson(payload);
      HttpRequest request = buildRequest(target, body);
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      int status = response.statusCode();
      if (status >= 200 && status < 300) {
        return DeliveryResult.delivered(responseData(response.body()), status, elapsedMs(start));
      }
      return DeliveryResult.failed("HTTP " + status, status, elapsedMs(start));
    } catch (IOException | IllegalArgumentException | DeliveryException e) {
      logger.log(Level.WARNING, "Webhook request to " + target + " failed", e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      return DeliveryResult.failed(message, null, elapsedMs(start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeliveryResult.failed("Interrupted", null, elapsedMs(start));
    }
  }

  HttpRequest buildRequest(URI target, String body) {
    HttpRequest.Builder builder = HttpRequest.newBuilder(target)
        .timeout(config.timeout())
        .method(webhook.method(), HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
        .header("Content-Type", webhook.contentType());
    webhook.headers().forEach(builder::header);
    if (webhook.authHeaderName() != null) {
      builder.header(webhook.authHeaderName(), webhook.authHeaderValue());
    }
    if (webhook.signed()) {
      builder.header(webhook.hmacHeader(), sign(body));
    }
    return builder.build();
  }

  /** Returns {@code <algorithm>=<hex HMAC of body>}. */
  String sign(String body) {
    String jcaName = webhook.hmacAlgorithm().equals("sha512") ? "HmacSHA512" : "HmacSHA256";
    try {
      Mac mac = Mac.getInstance(jcaName);
      mac.init(new SecretKeySpec(webhook.hmacSecret().getBytes(StandardCharsets.UTF_8), jcaName));
      byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
      return webhook.hmacAlgorithm() + "=" + HexFormat.of().formatHex(digest);
    } catch (GeneralSecurityException e) {
      throw new DeliveryException("Failed to sign webhook payload", e);
    }
  }

  private static Map<String, Object> responseData(String body) {
    Map<String, Object> parsed = ConnectorJson.parseObject(body);
    if (parsed != null) {
      return parsed;
    }
    Map<String, Object> text = new LinkedHashMap<>();
    text.put("text", body == null ? "" : body);
    return text;
  }
}
