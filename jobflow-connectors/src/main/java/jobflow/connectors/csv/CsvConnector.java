package jobflow.connectors.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import jobflow.connector.AbstractConnector;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryException;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorJson;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Appends one CSV row per delivered subject.
 *
 * <p>Files are named {@code <prefix>_<yyyyMMdd>[_<n>].csv[.gz]}. A new file starts when
 * the UTC day changes (with daily rotation) or when the current file reaches
 * {@link CsvExportConfig#maxRowsPerFile()}; numbered files carry the suffix
 * {@code _1}, {@code _2} and so on. Compressed output is appended as additional gzip
 * members, which standard gzip readers decode as one stream.
 *
 * <p>Writes are serialized on the connector instance.
 */
public final class CsvConnector extends AbstractConnector {
  private static final Logger logger = Logger.getLogger(CsvConnector.class.getName());

  public static final String TYPE = "csv";
  private static final DateTimeFormatter FILE_DATE =
      DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

  private final CsvExportConfig csvConfig;
  private final Clock clock;
  private final CsvMapper csvMapper = new CsvMapper();
  private final CsvSchema schema;

  private Path currentFile;
  private String currentDate;
  private int sequence;
  private long currentRowCount;

  public CsvConnector(ConnectorConfig config, CsvExportConfig csvConfig, DeliveryTracker tracker) {
    this(config, csvConfig, tracker, Clock.systemUTC());
  }

  public CsvConnector(ConnectorConfig config, CsvExportConfig csvConfig, DeliveryTracker tracker, Clock clock) {
    super(config, tracker);
    this.csvConfig = Objects.requireNonNull(csvConfig, "csvConfig");
    this.clock = Objects.requireNonNull(clock, "clock");
    CsvSchema.Builder builder = CsvSchema.builder();
    for (String column : csvConfig.columns()) {
      builder.addColumn(column);
    }
    this.schema = builder.build()
        .withColumnSeparator(csvConfig.delimiter())
        .withQuoteChar(csvConfig.quoteChar());
  }

  @Override
  public String connectorType() {
    return TYPE;
  }

  @Override
  public synchronized DeliveryResult deliver(DeliveryRequest request) {
    long start = System.nanoTime();
    try {
      writeRows(List.of(toRow(request)));
      return DeliveryResult.delivered(responseData(), null, elapsedMs(start));
    } catch (IOException | DeliveryException e) {
      logger.log(Level.WARNING, "CSV export of " + request.subjectId() + " failed", e);
      return DeliveryResult.failed(e.getMessage(), null, elapsedMs(start));
    }
  }

  /**
   * Writes all not yet delivered requests with one file operation per output file.
   */
  @Override
  public synchronized List<DeliveryResult> deliverBatch(List<DeliveryRequest> requests) {
    long start = System.nanoTime();
    List<DeliveryRequest> toWrite = new ArrayList<>();
    for (DeliveryRequest request : requests) {
      if (shouldDeliver(request.subjectId())) {
        toWrite.add(request);
      }
    }
    DeliveryResult shared = null;
    if (!toWrite.isEmpty()) {
      try {
        List<Map<String, String>> rows = new ArrayList<>(toWrite.size());
        for (DeliveryRequest request : toWrite) {
          rows.add(toRow(request));
        }
        writeRows(rows);
        shared = DeliveryResult.delivered(responseData(), null, elapsedMs(start));
      } catch (IOException | DeliveryException e) {
        logger.log(Level.WARNING, "CSV batch export of " + toWrite.size() + " rows failed", e);
        shared = DeliveryResult.failed(e.getMessage(), null, elapsedMs(start));
      }
    }
    List<DeliveryResult> results = new ArrayList<>(requests.size());
    for (DeliveryRequest request : requests) {
      if (!toWrite.contains(request)) {
        results.add(DeliveryResult.skipped());
        continue;
      }
      DeliveryResult result = shared.success()
          ? DeliveryResult.delivered(shared.responseData(), null, shared.durationMs())
          : DeliveryResult.failed(shared.error(), null, shared.durationMs());
      recordOutcome(request.subjectId(), result);
      results.add(result);
    }
    return results;
  }

  /** Counts files, data rows and bytes under the output directory that carry this connector's prefix. */
  public synchronized CsvExportStats exportStats() {
    Path dir = csvConfig.outputDir();
    int fileCount = 0;
    long totalRows = 0;
    long totalSize = 0;
    if (Files.isDirectory(dir)) {
      try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, csvConfig.filenamePrefix() + "_*.csv*")) {
        for (Path file : files) {
          fileCount++;
          totalSize += Files.size(file);
          totalRows += countRows(file);
        }
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to read export directory " + dir, e);
      }
    }
    return new CsvExportStats(dir, fileCount, totalRows, totalSize, currentFile, currentRowCount);
  }

  Map<String, String> toRow(DeliveryRequest request) {
    Map<String, String> row = new LinkedHashMap<>();
    csvConfig.fieldMapping().forEach((path, column) -> {
      if (!csvConfig.columns().contains(column)) {
        return;
      }
      if (path.equals("document_id")) {
        row.put(column, request.subjectId());
      } else {
        row.put(column, cellValue(extract(request.data(), path)));
      }
    });
    return row;
  }

  static Object extract(Map<String, Object> data, String path) {
    Object value = data;
    for (String part : path.split("\\.")) {
      if (!(value instanceof Map)) {
        return null;
      }
      value = ((Map<?, ?>) value).get(part);
    }
    return value;
  }

  private static String cellValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof Map || value instanceof Collection) {
      return ConnectorJson.toJson(value);
    }
    return value.toString();
  }

  private void writeRows(List<Map<String, String>> rows) throws IOException {
    int written = 0;
    while (written < rows.size()) {
      rotateIfNeeded();
      int remaining = rows.size() - written;
      int chunk = csvConfig.maxRowsPerFile() > 0
          ? (int) Math.min(remaining, csvConfig.maxRowsPerFile() - currentRowCount)
          : remaining;
      append(rows.subList(written, written + chunk));
      currentRowCount += chunk;
      written += chunk;
    }
  }

  private void rotateIfNeeded() throws IOException {
    String today = FILE_DATE.format(clock.instant());
    if (currentFile == null || (csvConfig.rotateDaily() && !today.equals(currentDate))) {
      currentDate = today;
      sequence = 0;
      open();
    } else if (csvConfig.maxRowsPerFile() > 0 && currentRowCount >= csvConfig.maxRowsPerFile()) {
      sequence++;
      open();
    }
  }

  private void open() throws IOException {
    Files.createDirectories(csvConfig.outputDir());
    currentFile = csvConfig.outputDir().resolve(fileName(currentDate, sequence));
    currentRowCount = 0;
    if (!csvConfig.appendMode()) {
      Files.deleteIfExists(currentFile);
    }
    logger.log(Level.FINE, "CSV export now writing to {0}", currentFile);
  }

  String fileName(String date, int seq) {
    StringBuilder name = new StringBuilder(csvConfig.filenamePrefix()).append('_').append(date);
    if (seq > 0) {
      name.append('_').append(seq);
    }
    name.append(".csv");
    if (csvConfig.compress()) {
      name.append(".gz");
    }
    return name.toString();
  }

  private void append(List<Map<String, String>> rows) throws IOException {
    boolean header = csvConfig.includeHeader()
        && (!Files.exists(currentFile) || Files.size(currentFile) == 0);
    OutputStream out = Files.newOutputStream(currentFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    if (csvConfig.compress()) {
      out = new GZIPOutputStream(out);
    }
    try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
         SequenceWriter sequenceWriter = csvMapper.writer(schema.withUseHeader(header)).writeValues(writer)) {
      sequenceWriter.writeAll(rows);
    }
  }

  private long countRows(Path file) throws IOException {
    InputStream in = Files.newInputStream(file);
    if (file.getFileName().toString().endsWith(".gz")) {
      in = new GZIPInputStream(in);
    }
    CsvSchema readSchema = CsvSchema.emptySchema()
        .withColumnSeparator(csvConfig.delimiter())
        .withQuoteChar(csvConfig.quoteChar());
    long rows = 0;
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
         MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
             .with(CsvParser.Feature.WRAP_AS_ARRAY)
             .with(readSchema)
             .readValues(reader)) {
      while (it.hasNextValue()) {
        it.nextValue();
        rows++;
      }
    }
    if (csvConfig.includeHeader() && rows > 0) {
      rows--;
    }
    return rows;
  }

  private Map<String, Object> responseData() {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("file", currentFile.toString());
    data.put("row_count", currentRowCount);
    return data;
  }
}
