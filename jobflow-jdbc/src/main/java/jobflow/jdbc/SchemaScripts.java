package jobflow.jdbc;

import jobflow.spi.JobStoreException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and applies the bundled DDL for the default job tables.
 *
 * <p>Scripts live on the classpath under {@code jobflow/jdbc/schema/<store>.sql},
 * where {@code <store>} is a job store name such as {@code h2} or {@code postgresql}.
 * Every statement uses {@code IF NOT EXISTS}, so applying a script twice is harmless.
 */
public final class SchemaScripts {
  private static final Logger logger = Logger.getLogger(SchemaScripts.class.getName());

  private SchemaScripts() {}

  public static String load(String storeName) {
    Objects.requireNonNull(storeName, "storeName");
    String resource = "schema/" + storeName.toLowerCase() + ".sql";
    try (InputStream in = SchemaScripts.class.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema script for job store: " + storeName);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new JobStoreException("Failed to read schema script " + resource, e);
    }
  }

  /** Splits a script into statements on {@code ;}, dropping {@code --} comment lines. */
  static List<String> statements(String script) {
    StringBuilder cleaned = new StringBuilder();
    for (String line : script.split("\\R")) {
      if (!line.trim().startsWith("--")) {
        cleaned.append(line).append('\n');
      }
    }
    List<String> result = new ArrayList<>();
    for (String statement : cleaned.toString().split(";")) {
      String trimmed = statement.trim();
      if (!trimmed.isEmpty()) {
        result.add(trimmed);
      }
    }
    return result;
  }

  public static void apply(Connection conn, String storeName) {
    List<String> statements = statements(load(storeName));
    try (Statement stmt = conn.createStatement()) {
      for (String sql : statements) {
        stmt.execute(sql);
      }
    } catch (SQLException e) {
      throw new JobStoreException("Failed to apply " + storeName + " schema", e);
    }
    logger.log(Level.FINE, "Applied {0} schema ({1} statements)",
        new Object[]{storeName, statements.size()});
  }

  public static void apply(DataSource dataSource, String storeName) {
    try (Connection conn = dataSource.getConnection()) {
      apply(conn, storeName);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to obtain connection for schema setup", e);
    }
  }
}
