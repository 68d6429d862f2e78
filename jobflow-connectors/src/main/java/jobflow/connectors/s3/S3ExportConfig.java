package jobflow.connectors.s3;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bucket layout and upload options for {@link S3Connector}.
 */
public final class S3ExportConfig {
  public static final String SSE_AES256 = "AES256";
  public static final String SSE_KMS = "aws:kms";

  private final String bucket;
  private final String keyPrefix;
  private final String contentType;
  private final String serverSideEncryption;
  private final String kmsKeyId;
  private final String storageClass;
  private final Map<String, String> tags;

  private S3ExportConfig(Builder builder) {
    this.bucket = builder.bucket;
    this.keyPrefix = builder.keyPrefix;
    this.contentType = builder.contentType;
    this.serverSideEncryption = builder.serverSideEncryption;
    this.kmsKeyId = builder.kmsKeyId;
    this.storageClass = builder.storageClass;
    this.tags = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tags));
  }

  public static Builder builder(String bucket) {
    return new Builder(bucket);
  }

  public String bucket() {
    return bucket;
  }

  public String keyPrefix() {
    return keyPrefix;
  }

  public String contentType() {
    return contentType;
  }

  /** {@code AES256}, {@code aws:kms} or {@code null} for none. */
  public String serverSideEncryption() {
    return serverSideEncryption;
  }

  public String kmsKeyId() {
    return kmsKeyId;
  }

  public String storageClass() {
    return storageClass;
  }

  /** Object tags, in insertion order. */
  public Map<String, String> tags() {
    return tags;
  }

  public static final class Builder {
    private final String bucket;
    private String keyPrefix = "invoices/";
    private String contentType = "application/json";
    private String serverSideEncryption = SSE_AES256;
    private String kmsKeyId;
    private String storageClass = "STANDARD";
    private final Map<String, String> tags = new LinkedHashMap<>();

    private Builder(String bucket) {
      Objects.requireNonNull(bucket, "bucket");
      if (bucket.isBlank()) {
        throw new IllegalArgumentException("bucket must not be blank");
      }
      this.bucket = bucket;
    }

    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
      return this;
    }

    public Builder contentType(String contentType) {
      this.contentType = Objects.requireNonNull(contentType, "contentType");
      return this;
    }

    public Builder serverSideEncryption(String serverSideEncryption) {
      if (serverSideEncryption != null
          && !SSE_AES256.equals(serverSideEncryption) && !SSE_KMS.equals(serverSideEncryption)) {
        throw new IllegalArgumentException("Unsupported server-side encryption: " + serverSideEncryption);
      }
      this.serverSideEncryption = serverSideEncryption;
      return this;
    }

    /** KMS key for {@code aws:kms} encryption; ignored otherwise. */
    public Builder kmsKeyId(String kmsKeyId) {
      this.kmsKeyId = kmsKeyId;
      return this;
    }

    public Builder storageClass(String storageClass) {
      this.storageClass = Objects.requireNonNull(storageClass, "storageClass");
      return this;
    }

    public Builder tag(String key, String value) {
      tags.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public S3ExportConfig build() {
      return new S3ExportConfig(this);
    }
  }
}
