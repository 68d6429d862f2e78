package jobflow.connectors.database;

import jobflow.connector.AbstractConnector;
import jobflow.connector.ConnectorConfig;
import jobflow.connector.DeliveryException;
import jobflow.connector.DeliveryRequest;
import jobflow.connector.DeliveryResult;
import jobflow.connector.DeliveryTracker;
import jobflow.connectors.ConnectorJson;
import jobflow.jdbc.JdbcTemplate;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStoreException;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Writes delivered subjects as rows of an external table.
 *
 * <p>With upsert enabled an existing row (matched on the upsert key) is updated in
 * place and keeps its created-at value; otherwise a row is inserted. Upsert is an
 * UPDATE followed by an INSERT when nothing matched, run in one transaction, so it
 * works on any database without vendor-specific merge syntax.
 */
public final class DatabaseConnector extends AbstractConnector {
  private static final Logger logger = Logger.getLogger(DatabaseConnector.class.getName());

  public static final String TYPE = "database";

  private final DatabaseExportConfig exportConfig;
  private final ConnectionProvider connectionProvider;
  private final Clock clock;

  public DatabaseConnector(ConnectorConfig config, DatabaseExportConfig exportConfig,
      ConnectionProvider connectionProvider, DeliveryTracker tracker) {
    this(config, exportConfig, connectionProvider, tracker, Clock.systemUTC());
  }

  public DatabaseConnector(ConnectorConfig config, DatabaseExportConfig exportConfig,
      ConnectionProvider connectionProvider, DeliveryTracker tracker, Clock clock) {
    super(config, tracker);
    this.exportConfig = Objects.requireNonNull(exportConfig, "exportConfig");
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String connectorType() {
    return TYPE;
  }

  @Override
  public DeliveryResult deliver(DeliveryRequest request) {
    long start = System.nanoTime();
    try (Connection conn = connectionProvider.getConnection()) {
      String action = inTransaction(conn, () -> write(conn, request, now()));
      return DeliveryResult.delivered(responseData(action), null, elapsedMs(start));
    } catch (SQLException | JobStoreException | DeliveryException e) {
      logger.log(Level.WARNING, "Database export of " + request.subjectId() + " failed", e);
      return DeliveryResult.failed(e.getMessage(), null, elapsedMs(start));
    }
  }

  /**
   * Writes every deliverable request in one transaction. Requests already delivered
   * are reported as skipped; if the transaction fails every written request fails.
   */
  @Override
  public List<DeliveryResult> deliverBatch(List<DeliveryRequest> requests) {
    List<DeliveryRequest> all = new ArrayList<>(requests);
    List<DeliveryRequest> toWrite = all.stream()
        .filter(r -> shouldDeliver(r.subjectId()))
        .collect(Collectors.toList());
    if (toWrite.isEmpty()) {
      return all.stream().map(r -> DeliveryResult.skipped()).collect(Collectors.toList());
    }

    long start = System.nanoTime();
    DeliveryResult shared;
    try (Connection conn = connectionProvider.getConnection()) {
      Timestamp now = now();
      inTransaction(conn, () -> {
        for (DeliveryRequest request : toWrite) {
          write(conn, request, now);
        }
        return null;
      });
      shared = DeliveryResult.delivered(Map.of("table", exportConfig.tableName()), null, elapsedMs(start));
    } catch (SQLException | JobStoreException | DeliveryException e) {
      logger.log(Level.WARNING, "Database batch export of " + toWrite.size() + " rows failed", e);
      shared = DeliveryResult.failed(e.getMessage(), null, elapsedMs(start));
    }

    List<DeliveryResult> results = new ArrayList<>(all.size());
    for (DeliveryRequest request : all) {
      if (toWrite.contains(request)) {
        DeliveryResult result = shared.success()
            ? DeliveryResult.delivered(shared.responseData(), null, shared.durationMs())
            : DeliveryResult.failed(shared.error(), null, shared.durationMs());
        recordOutcome(request.subjectId(), result);
        results.add(result);
      } else {
        results.add(DeliveryResult.skipped());
      }
    }
    return results;
  }

  private String write(Connection conn, DeliveryRequest request, Timestamp now) {
    Map<String, Object> values = columnValues(request);
    if (exportConfig.enableUpsert()) {
      Map<String, Object> updates = new LinkedHashMap<>(values);
      updates.remove(exportConfig.upsertKey());
      updates.put(exportConfig.updatedAtColumn(), now);
      List<Object> params = new ArrayList<>(updates.values());
      params.add(request.subjectId());
      String sql = "UPDATE " + exportConfig.tableName() + " SET "
          + updates.keySet().stream().map(c -> c + "=?").collect(Collectors.joining(", "))
          + " WHERE " + exportConfig.upsertKey() + "=?";
      if (JdbcTemplate.update(conn, sql, params.toArray()) > 0) {
        return "updated";
      }
    }
    Map<String, Object> row = new LinkedHashMap<>(values);
    row.put(exportConfig.createdAtColumn(), now);
    row.put(exportConfig.updatedAtColumn(), now);
    String sql = "INSERT INTO " + exportConfig.tableName() + " ("
        + String.join(", ", row.keySet()) + ") VALUES ("
        + row.keySet().stream().map(c -> "?").collect(Collectors.joining(", ")) + ")";
    JdbcTemplate.update(conn, sql, row.values().toArray());
    return "inserted";
  }

  Map<String, Object> columnValues(DeliveryRequest request) {
    Map<String, Object> values = new LinkedHashMap<>();
    values.put(exportConfig.upsertKey(), request.subjectId());
    exportConfig.columnMapping().forEach((field, column) -> {
      if (!field.equals("document_id") && request.data().containsKey(field)) {
        values.put(column, columnValue(request.data().get(field)));
      }
    });
    if (exportConfig.jsonColumn() != null) {
      Map<String, Object> raw = new LinkedHashMap<>();
      raw.put("data", request.data());
      raw.put("metadata", request.metadata());
      values.put(exportConfig.jsonColumn(), ConnectorJson.toJson(raw));
    }
    return values;
  }

  private static Object columnValue(Object value) {
    if (value instanceof Map || value instanceof Collection) {
      return ConnectorJson.toJson(value);
    }
    return value;
  }

  private Map<String, Object> responseData(String action) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("table", exportConfig.tableName());
    data.put("operation", exportConfig.enableUpsert() ? "upsert" : "insert");
    data.put("action", action);
    return data;
  }

  private Timestamp now() {
    return Timestamp.from(clock.instant());
  }

  private interface SqlWork<T> {
    T run();
  }

  private static <T> T inTransaction(Connection conn, SqlWork<T> work) throws SQLException {
    boolean autoCommit = conn.getAutoCommit();
    conn.setAutoCommit(false);
    try {
      T result = work.run();
      conn.commit();
      return result;
    } catch (RuntimeException e) {
      try {
        conn.rollback();
      } catch (SQLException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      conn.setAutoCommit(autoCommit);
    }
  }
}
