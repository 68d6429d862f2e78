package jobflow.jdbc;

import java.util.Objects;

/**
 * Table naming shared by the JDBC job stores and the database connector.
 */
public final class TableNames {
  public static final String DEFAULT_TABLE = "jobflow_job";
  public static final String DEPENDENCY_SUFFIX = "_dependency";
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /** Name of the dependency edge table that belongs to the given job table. */
  public static String dependencyTable(String jobTable) {
    return validate(jobTable) + DEPENDENCY_SUFFIX;
  }
}
