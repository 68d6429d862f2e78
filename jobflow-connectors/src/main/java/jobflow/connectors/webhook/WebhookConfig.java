package jobflow.connectors.webhook;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Destination settings for {@link WebhookConnector}.
 *
 * <p>At most one authentication scheme applies; the last one set wins.
 */
public final class WebhookConfig {
  public static final String DEFAULT_SIGNATURE_HEADER = "X-Signature";
  public static final String DEFAULT_API_KEY_HEADER = "X-API-Key";

  private final URI url;
  private final URI batchUrl;
  private final String method;
  private final String contentType;
  private final Map<String, String> headers;
  private final String authHeaderName;
  private final String authHeaderValue;
  private final String hmacSecret;
  private final String hmacHeader;
  private final String hmacAlgorithm;

  private WebhookConfig(Builder builder) {
    this.url = Objects.requireNonNull(builder.url, "url");
    this.batchUrl = builder.batchUrl;
    this.method = builder.method;
    this.contentType = builder.contentType;
    this.headers = Map.copyOf(builder.headers);
    this.authHeaderName = builder.authHeaderName;
    this.authHeaderValue = builder.authHeaderValue;
    this.hmacSecret = builder.hmacSecret;
    this.hmacHeader = builder.hmacHeader;
    this.hmacAlgorithm = builder.hmacAlgorithm;
  }

  public static Builder builder(String url) {
    return new Builder(URI.create(url));
  }

  public static Builder builder(URI url) {
    return new Builder(url);
  }

  public URI url() {
    return url;
  }

  /** Endpoint accepting {@code {"batch": [...]}} payloads, or {@code null}. */
  public URI batchUrl() {
    return batchUrl;
  }

  public String method() {
    return method;
  }

  public String contentType() {
    return contentType;
  }

  public Map<String, String> headers() {
    return headers;
  }

  String authHeaderName() {
    return authHeaderName;
  }

  String authHeaderValue() {
    return authHeaderValue;
  }

  public boolean signed() {
    return hmacSecret != null;
  }

  String hmacSecret() {
    return hmacSecret;
  }

  public String hmacHeader() {
    return hmacHeader;
  }

  /** {@code sha256} or {@code sha512}. */
  public String hmacAlgorithm() {
    return hmacAlgorithm;
  }

  public static final class Builder {
    private final URI url;
    private URI batchUrl;
    private String method = "POST";
    private String contentType = "application/json";
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String authHeaderName;
    private String authHeaderValue;
    private String hmacSecret;
    private String hmacHeader = DEFAULT_SIGNATURE_HEADER;
    private String hmacAlgorithm = "sha256";

    private Builder(URI url) {
      this.url = Objects.requireNonNull(url, "url");
    }

    public Builder batchUrl(String batchUrl) {
      this.batchUrl = batchUrl == null ? null : URI.create(batchUrl);
      return this;
    }

    public Builder method(String method) {
      Objects.requireNonNull(method, "method");
      this.method = method.toUpperCase(Locale.ROOT);
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = Objects.requireNonNull(contentType, "contentType");
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder bearerToken(String token) {
      Objects.requireNonNull(token, "token");
      return auth("Authorization", "Bearer " + token);
    }

    public Builder basicAuth(String username, String password) {
      Objects.requireNonNull(username, "username");
      Objects.requireNonNull(password, "password");
      String encoded = Base64.getEncoder()
          .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
      return auth("Authorization", "Basic " + encoded);
    }

    public Builder apiKey(String key) {
      return apiKey(DEFAULT_API_KEY_HEADER, key);
    }

    public Builder apiKey(String header, String key) {
      return auth(Objects.requireNonNull(header, "header"), Objects.requireNonNull(key, "key"));
    }

    private Builder auth(String name, String value) {
      this.authHeaderName = name;
      this.authHeaderValue = value;
      return this;
    }

    /**
     * Signs each request body with HMAC, sending {@code <algorithm>=<hex digest>}
     * in the signature header.
     */
    public Builder hmacSecret(String hmacSecret) {
      this.hmacSecret = Objects.requireNonNull(hmacSecret, "hmacSecret");
      return this;
    }

    public Builder hmacHeader(String hmacHeader) {
      this.hmacHeader = Objects.requireNonNull(hmacHeader, "hmacHeader");
      return this;
    }

    public Builder hmacAlgorithm(String hmacAlgorithm) {
      Objects.requireNonNull(hmacAlgorithm, "hmacAlgorithm");
      String normalized = hmacAlgorithm.toLowerCase(Locale.ROOT);
      if (!normalized.equals("sha256") && !normalized.equals("sha512")) {
        throw new IllegalArgumentException("Unsupported HMAC algorithm: " + hmacAlgorithm);
      }
      this.hmacAlgorithm = normalized;
      return this;
    }

    public WebhookConfig build() {
      return new WebhookConfig(this);
    }
  }
}
