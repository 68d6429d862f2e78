package jobflow.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC job stores with auto-detection support.
 *
 * <p>Job stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/jobflow.jdbc.store.AbstractJdbcJobStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 * AbstractJdbcJobStore store = JdbcJobStores.get("postgresql").withTableName("billing_job");
 * }</pre>
 */
public final class JdbcJobStores {

  private static final List<AbstractJdbcJobStore> STORES;
  private static final Map<String, AbstractJdbcJobStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcJobStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcJobStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(), store);
    }
  }

  private JdbcJobStores() {
  }

  /**
   * Returns all registered job stores.
   */
  public static List<AbstractJdbcJobStore> all() {
    return STORES;
  }

  /**
   * Gets a job store by name.
   *
   * @param name job store name (case-insensitive)
   * @return the job store
   * @throws IllegalArgumentException if no job store found
   */
  public static AbstractJdbcJobStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcJobStore store = BY_NAME.get(name.toLowerCase());
    if (store == null) {
      throw new IllegalArgumentException("Unknown job store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the job store from a DataSource.
   *
   * @throws IllegalStateException if the connection metadata cannot be read
   */
  public static AbstractJdbcJobStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect job store from DataSource", e);
    }
  }

  /**
   * Auto-detects the job store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching job store found
   */
  public static AbstractJdbcJobStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    for (AbstractJdbcJobStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
          return store;
        }
      }
    }

    throw new IllegalArgumentException("No job store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
