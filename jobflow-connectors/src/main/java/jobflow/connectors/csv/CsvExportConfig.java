package jobflow.connectors.csv;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output layout for {@link CsvConnector}.
 *
 * <p>{@code fieldMapping} maps dot-separated data paths (for example
 * {@code supplier.name}) to column names. Only mapped columns that also appear in
 * {@code columns} are written, in {@code columns} order.
 */
public final class CsvExportConfig {
  private final Path outputDir;
  private final String filenamePrefix;
  private final List<String> columns;
  private final Map<String, String> fieldMapping;
  private final char delimiter;
  private final char quoteChar;
  private final boolean includeHeader;
  private final boolean appendMode;
  private final boolean compress;
  private final boolean rotateDaily;
  private final int maxRowsPerFile;

  private CsvExportConfig(Builder builder) {
    this.outputDir = builder.outputDir;
    this.filenamePrefix = builder.filenamePrefix;
    this.columns = List.copyOf(builder.columns);
    this.fieldMapping = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldMapping));
    this.delimiter = builder.delimiter;
    this.quoteChar = builder.quoteChar;
    this.includeHeader = builder.includeHeader;
    this.appendMode = builder.appendMode;
    this.compress = builder.compress;
    this.rotateDaily = builder.rotateDaily;
    this.maxRowsPerFile = builder.maxRowsPerFile;
  }

  public static Builder builder(Path outputDir) {
    return new Builder(outputDir);
  }

  public Path outputDir() {
    return outputDir;
  }

  public String filenamePrefix() {
    return filenamePrefix;
  }

  public List<String> columns() {
    return columns;
  }

  public Map<String, String> fieldMapping() {
    return fieldMapping;
  }

  public char delimiter() {
    return delimiter;
  }

  public char quoteChar() {
    return quoteChar;
  }

  public boolean includeHeader() {
    return includeHeader;
  }

  public boolean appendMode() {
    return appendMode;
  }

  public boolean compress() {
    return compress;
  }

  public boolean rotateDaily() {
    return rotateDaily;
  }

  /** Rows per file before a new numbered file is started; 0 for no limit. */
  public int maxRowsPerFile() {
    return maxRowsPerFile;
  }

  public static final class Builder {
    private final Path outputDir;
    private String filenamePrefix = "invoices";
    private List<String> columns = List.of(
        "document_id", "invoice_number", "total_amount", "currency", "invoice_date",
        "due_date", "supplier_name", "customer_name", "status");
    private Map<String, String> fieldMapping = defaultMapping();
    private char delimiter = ',';
    private char quoteChar = '"';
    private boolean includeHeader = true;
    private boolean appendMode = true;
    private boolean compress;
    private boolean rotateDaily = true;
    private int maxRowsPerFile;

    private Builder(Path outputDir) {
      this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    private static Map<String, String> defaultMapping() {
      Map<String, String> mapping = new LinkedHashMap<>();
      mapping.put("document_id", "document_id");
      mapping.put("invoice_number", "invoice_number");
      mapping.put("total_amount", "total_amount");
      mapping.put("currency", "currency");
      mapping.put("invoice_date", "invoice_date");
      mapping.put("due_date", "due_date");
      mapping.put("supplier.name", "supplier_name");
      mapping.put("customer.name", "customer_name");
      mapping.put("status", "status");
      return mapping;
    }

    public Builder filenamePrefix(String filenamePrefix) {
      Objects.requireNonNull(filenamePrefix, "filenamePrefix");
      if (filenamePrefix.isBlank() || filenamePrefix.contains("/") || filenamePrefix.contains("\\")) {
        throw new IllegalArgumentException("Invalid filename prefix: " + filenamePrefix);
      }
      this.filenamePrefix = filenamePrefix;
      return this;
    }

    public Builder columns(List<String> columns) {
      Objects.requireNonNull(columns, "columns");
      if (columns.isEmpty()) {
        throw new IllegalArgumentException("columns must not be empty");
      }
      this.columns = columns;
      return this;
    }

    public Builder fieldMapping(Map<String, String> fieldMapping) {
      this.fieldMapping = Objects.requireNonNull(fieldMapping, "fieldMapping");
      return this;
    }

    public Builder delimiter(char delimiter) {
      this.delimiter = delimiter;
      return this;
    }

    public Builder quoteChar(char quoteChar) {
      this.quoteChar = quoteChar;
      return this;
    }

    public Builder includeHeader(boolean includeHeader) {
      this.includeHeader = includeHeader;
      return this;
    }

    /** When false, each file is truncated the first time it is opened. */
    public Builder appendMode(boolean appendMode) {
      this.appendMode = appendMode;
      return this;
    }

    /** Write {@code .csv.gz} files. */
    public Builder compress(boolean compress) {
      this.compress = compress;
      return this;
    }

    public Builder rotateDaily(boolean rotateDaily) {
      this.rotateDaily = rotateDaily;
      return this;
    }

    public Builder maxRowsPerFile(int maxRowsPerFile) {
      if (maxRowsPerFile < 0) {
        throw new IllegalArgumentException("maxRowsPerFile must be >= 0");
      }
      this.maxRowsPerFile = maxRowsPerFile;
      return this;
    }

    public CsvExportConfig build() {
      return new CsvExportConfig(this);
    }
  }
}
