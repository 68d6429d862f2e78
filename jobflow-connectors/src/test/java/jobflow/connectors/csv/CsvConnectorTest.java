package jobflow.connectors.csv;

import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorTestSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvConnectorTest {

  @TempDir
  Path dir;

  /** Clock the test can move forward. */
  static final class SettableClock extends Clock {
    private Instant now;

    SettableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  private final SettableClock clock = new SettableClock(Instant.parse("2024-03-15T22:00:00Z"));

  private CsvConnector connector(CsvExportConfig csvConfig) {
    return connector(csvConfig, null);
  }

  private CsvConnector connector(CsvExportConfig csvConfig, DeliveryTracker tracker) {
    return new CsvConnector(ConnectorConfig.builder().maxRetries(0).build(), csvConfig, tracker, clock);
  }

  private static Map<String, Object> invoice(String number) {
    return Map.of(
        "invoice_number", number,
        "total_amount", 12.5,
        "supplier", Map.of("name", "Acme, Inc."),
        "status", "new");
  }

  @Test
  void writesHeaderOnceAndMapsNestedFields() throws IOException {
    CsvConnector connector = connector(CsvExportConfig.builder(dir)
        .columns(List.of("document_id", "invoice_number", "supplier_name", "status"))
        .build());

    DeliveryResult first = connector.deliver(DeliveryRequest.of("doc-1", invoice("INV-1")));
    connector.deliver(DeliveryRequest.of("doc-2", invoice("INV-2")));

    assertTrue(first.success(), first.error());
    Path file = dir.resolve("invoices_20240315.csv");
    assertEquals(file.toString(), first.responseData().get("file"));
    assertEquals(1L, first.responseData().get("row_count"));

    List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    assertEquals(List.of(
        "document_id,invoice_number,supplier_name,status",
        "doc-1,INV-1,\"Acme, Inc.\",new",
        "doc-2,INV-2,\"Acme, Inc.\",new"), lines);
  }

  @Test
  void customDelimiterAndNoHeader() throws IOException {
    CsvConnector connector = connector(CsvExportConfig.builder(dir)
        .columns(List.of("document_id", "total_amount"))
        .delimiter(';')
        .includeHeader(false)
        .build());

    connector.deliver(DeliveryRequest.of("doc-1", invoice("INV-1")));

    assertEquals(List.of("doc-1;12.5"), Files.readAllLines(dir.resolve("invoices_20240315.csv")));
  }

  @Test
  void rotatesDaily() {
    CsvConnector connector = connector(CsvExportConfig.builder(dir).build());

    connector.deliver(DeliveryRequest.of("doc-1", invoice("INV-1")));
    clock.advance(Duration.ofHours(3));
    DeliveryResult next = connector.deliver(DeliveryRequest.of("doc-2", invoice("INV-2")));

    assertEquals(dir.resolve("invoices_20240316.csv").toString(), next.responseData().get("file"));
    assertTrue(Files.exists(dir.resolve("invoices_20240315.csv")));
  }

  @Test
  void rotatesByRowCountWithinBatch() {
    CsvConnector connector = connector(CsvExportConfig.builder(dir).maxRowsPerFile(2).build());

    List<DeliveryResult> results = connector.deliverBatch(List.of(
        DeliveryRequest.of("doc-1", invoice("INV-1")),
        DeliveryRequest.of("doc-2", invoice("INV-2")),
        DeliveryRequest.of("doc-3", invoice("INV-3")),
        DeliveryRequest.of("doc-4", invoice("INV-4")),
        DeliveryRequest.of("doc-5", invoice("INV-5"))));

    assertEquals(5, results.size());
    assertTrue(results.stream().allMatch(DeliveryResult::success));
    assertTrue(Files.exists(dir.resolve("invoices_20240315.csv")));
    assertTrue(Files.exists(dir.resolve("invoices_20240315_1.csv")));
    assertTrue(Files.exists(dir.resolve("invoices_20240315_2.csv")));

    CsvExportStats stats = connector.exportStats();
    assertEquals(3, stats.fileCount());
    assertEquals(5, stats.totalRows());
    assertEquals(1, stats.currentRowCount());
    assertEquals(dir.resolve("invoices_20240315_2.csv"), stats.currentFile());
  }

  @Test
  void overwriteModeTruncatesExistingFile() throws IOException {
    Files.writeString(dir.resolve("invoices_20240315.csv"), "stale\n");
    CsvConnector connector = connector(CsvExportConfig.builder(dir)
        .columns(List.of("document_id"))
        .appendMode(false)
        .build());

    connector.deliver(DeliveryRequest.of("doc-1", Map.of()));
    connector.deliver(DeliveryRequest.of("doc-2", Map.of()));

    assertEquals(List.of("document_id", "doc-1", "doc-2"), Files.readAllLines(dir.resolve("invoices_20240315.csv")));
  }

  @Test
  void compressedAppendsAreReadableAsOneStream() throws IOException {
    CsvConnector connector = connector(CsvExportConfig.builder(dir)
        .columns(List.of("document_id", "status"))
        .compress(true)
        .build());

    connector.deliver(DeliveryRequest.of("doc-1", invoice("INV-1")));
    connector.deliver(DeliveryRequest.of("doc-2", invoice("INV-2")));

    Path file = dir.resolve("invoices_20240315.csv.gz");
    String content;
    try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
      content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
    assertEquals("document_id,status\ndoc-1,new\ndoc-2,new\n", content);
    assertEquals(2, connector.exportStats().totalRows());
  }

  @Test
  void trackedBatchSkipsDeliveredSubjects() throws IOException {
    DeliveryTracker tracker = ConnectorTestSupport.tracker();
    CsvConnector connector = connector(CsvExportConfig.builder(dir).columns(List.of("document_id")).build(), tracker);
    assertTrue(connector.deliverWithRetry("doc-1", Map.of(), Map.of()).success());

    List<DeliveryResult> results = connector.deliverBatch(List.of(
        DeliveryRequest.of("doc-1", Map.of()),
        DeliveryRequest.of("doc-2", Map.of())));

    assertTrue(results.get(0).isSkipped());
    assertFalse(results.get(1).isSkipped());
    assertEquals(List.of("document_id", "doc-1", "doc-2"), Files.readAllLines(dir.resolve("invoices_20240315.csv")));
    assertTrue(tracker.checkDelivered("doc-2", CsvConnector.TYPE));
  }
}
