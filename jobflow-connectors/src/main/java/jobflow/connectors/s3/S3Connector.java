package jobflow.connectors.s3;

import jobflow.connector.AbstractConnector;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryException;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorJson;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Uploads each subject as a JSON object to S3.
 *
 * <p>Objects are keyed {@code <prefix><yyyy/MM/dd>/<subjectId>.json} (UTC date of the
 * upload). Caller metadata becomes S3 user metadata with {@code _} replaced by
 * {@code -} in keys and values cut to 1024 characters.
 */
public final class S3Connector extends AbstractConnector {
  private static final Logger logger = Logger.getLogger(S3Connector.class.getName());

  public static final String TYPE = "s3";
  static final int MAX_METADATA_VALUE_LENGTH = 1024;
  private static final DateTimeFormatter DATE_PATH =
      DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

  private final S3ExportConfig s3Config;
  private final S3Client s3Client;
  private final Clock clock;

  public S3Connector(ConnectorConfig config, S3ExportConfig s3Config, S3Client s3Client,
      DeliveryTracker tracker) {
    this(config, s3Config, s3Client, tracker, Clock.systemUTC());
  }

  public S3Connector(ConnectorConfig config, S3ExportConfig s3Config, S3Client s3Client,
      DeliveryTracker tracker, Clock clock) {
    super(config, tracker);
    this.s3Config = Objects.requireNonNull(s3Config, "s3Config");
    this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String connectorType() {
    return TYPE;
  }

  /** Object key the subject is uploaded to today. */
  public String objectKey(String subjectId) {
    return s3Config.keyPrefix() + DATE_PATH.format(clock.instant()) + "/" + subjectId + ".json";
  }

  /** {@code s3://bucket/key} of the subject's object for today. */
  public String objectUri(String subjectId) {
    return "s3://" + s3Config.bucket() + "/" + objectKey(subjectId);
  }

  @Override
  public DeliveryResult deliver(DeliveryRequest request) {
    long start = System.nanoTime();
    String key = objectKey(request.subjectId());
    try {
      Map<String, Object> payload = new LinkedHashMap<>();
      payload.put("document_id", request.subjectId());
      payload.put("data", request.data());
      payload.put("metadata", request.metadata());
      payload.put("uploaded_at", clock.instant().toString());
      byte[] body = ConnectorJson.toPrettyJson(payload).getBytes(StandardCharsets.UTF_8);

      PutObjectResponse response = s3Client.putObject(putRequest(key, request), RequestBody.fromBytes(body));

      Map<String, Object> data = new LinkedHashMap<>();
      data.put("s3_key", key);
      data.put("bucket", s3Config.bucket());
      data.put("etag", stripQuotes(response.eTag()));
      data.put("version_id", response.versionId());
      return DeliveryResult.delivered(data, null, elapsedMs(start));
    } catch (SdkException | DeliveryException e) {
      logger.log(Level.WARNING, "S3 upload of " + key + " failed", e);
      String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
      return DeliveryResult.failed(message, null, elapsedMs(start));
    }
  }

  PutObjectRequest putRequest(String key, DeliveryRequest request) {
    PutObjectRequest.Builder builder = PutObjectRequest.builder()
        .bucket(s3Config.bucket())
        .key(key)
        .contentType(s3Config.contentType())
        .storageClass(s3Config.storageClass())
        .metadata(userMetadata(request))
        .overrideConfiguration(o -> o.apiCallTimeout(config.timeout()));
    if (s3Config.serverSideEncryption() != null) {
      builder.serverSideEncryption(s3Config.serverSideEncryption());
      if (S3ExportConfig.SSE_KMS.equals(s3Config.serverSideEncryption()) && s3Config.kmsKeyId() != null) {
        builder.ssekmsKeyId(s3Config.kmsKeyId());
      }
    }
    if (!s3Config.tags().isEmpty()) {
      StringJoiner tagging = new StringJoiner("&");
      s3Config.tags().forEach((k, v) -> tagging.add(k + "=" + v));
      builder.tagging(tagging.toString());
    }
    return builder.build();
  }

  static Map<String, String> userMetadata(DeliveryRequest request) {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("document-id", request.subjectId());
    metadata.put("source", "jobflow-connector");
    request.metadata().forEach((key, value) -> {
      String text = String.valueOf(value);
      if (text.length() > MAX_METADATA_VALUE_LENGTH) {
        text = text.substring(0, MAX_METADATA_VALUE_LENGTH);
      }
      metadata.put(key.replace('_', '-'), text);
    });
    return metadata;
  }

  private static String stripQuotes(String etag) {
    if (etag == null) {
      return "";
    }
    String result = etag;
    if (result.startsWith("\"")) {
      result = result.substring(1);
    }
    if (result.endsWith("\"")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
