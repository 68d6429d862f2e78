package jobflow.connectors.database;

import jobflow.jdbc.TableNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Target table layout for {@link DatabaseConnector}.
 *
 * <p>All table and column names are checked against {@link TableNames#validate(String)}
 * because they are concatenated into SQL.
 */
public final class DatabaseExportConfig {
  private final String tableName;
  private final Map<String, String> columnMapping;
  private final String upsertKey;
  private final boolean enableUpsert;
  private final String jsonColumn;
  private final String createdAtColumn;
  private final String updatedAtColumn;

  private DatabaseExportConfig(Builder builder) {
    this.tableName = builder.tableName;
    this.columnMapping = Collections.unmodifiableMap(new LinkedHashMap<>(builder.columnMapping));
    this.upsertKey = builder.upsertKey;
    this.enableUpsert = builder.enableUpsert;
    this.jsonColumn = builder.jsonColumn;
    this.createdAtColumn = builder.createdAtColumn;
    this.updatedAtColumn = builder.updatedAtColumn;
  }

  public static DatabaseExportConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String tableName() {
    return tableName;
  }

  /** Data field name to column name. */
  public Map<String, String> columnMapping() {
    return columnMapping;
  }

  public String upsertKey() {
    return upsertKey;
  }

  public boolean enableUpsert() {
    return enableUpsert;
  }

  /** Column receiving the full {@code {data, metadata}} document, or {@code null}. */
  public String jsonColumn() {
    return jsonColumn;
  }

  public String createdAtColumn() {
    return createdAtColumn;
  }

  public String updatedAtColumn() {
    return updatedAtColumn;
  }

  public static final class Builder {
    private String tableName = "processed_invoices";
    private Map<String, String> columnMapping = defaultMapping();
    private String upsertKey = "document_id";
    private boolean enableUpsert = true;
    private String jsonColumn = "raw_data";
    private String createdAtColumn = "created_at";
    private String updatedAtColumn = "updated_at";

    private Builder() {}

    private static Map<String, String> defaultMapping() {
      Map<String, String> mapping = new LinkedHashMap<>();
      mapping.put("document_id", "document_id");
      mapping.put("invoice_number", "invoice_number");
      mapping.put("total_amount", "total_amount");
      mapping.put("currency", "currency");
      mapping.put("invoice_date", "invoice_date");
      mapping.put("status", "status");
      return mapping;
    }

    public Builder tableName(String tableName) {
      this.tableName = TableNames.validate(tableName);
      return this;
    }

    /** Replaces the whole mapping. */
    public Builder columnMapping(Map<String, String> columnMapping) {
      Objects.requireNonNull(columnMapping, "columnMapping");
      Map<String, String> copy = new LinkedHashMap<>();
      columnMapping.forEach((field, column) -> copy.put(field, TableNames.validate(column)));
      this.columnMapping = copy;
      return this;
    }

    public Builder upsertKey(String upsertKey) {
      this.upsertKey = TableNames.validate(upsertKey);
      return this;
    }

    public Builder enableUpsert(boolean enableUpsert) {
      this.enableUpsert = enableUpsert;
      return this;
    }

    /** Pass {@code null} to skip the raw JSON column. */
    public Builder jsonColumn(String jsonColumn) {
      this.jsonColumn = jsonColumn == null ? null : TableNames.validate(jsonColumn);
      return this;
    }

    public Builder createdAtColumn(String createdAtColumn) {
      this.createdAtColumn = TableNames.validate(createdAtColumn);
      return this;
    }

    public Builder updatedAtColumn(String updatedAtColumn) {
      this.updatedAtColumn = TableNames.validate(updatedAtColumn);
      return this;
    }

    public DatabaseExportConfig build() {
      return new DatabaseExportConfig(this);
    }
  }
}
