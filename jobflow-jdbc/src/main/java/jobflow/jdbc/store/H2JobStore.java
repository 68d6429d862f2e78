package jobflow.jdbc.store;

import java.util.List;

/**
 * H2 job store. Uses the portable SQL from {@link AbstractJdbcJobStore} as is.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new H2JobStore(tableName);
  }
}
