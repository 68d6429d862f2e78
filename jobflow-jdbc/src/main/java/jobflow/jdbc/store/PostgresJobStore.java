package jobflow.jdbc.store;

import jobflow.jdbc.JdbcTemplate;
import jobflow.model.Job;
import jobflow.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL job store.
 *
 * <p>Claims with a single {@code UPDATE ... RETURNING} round-trip instead of
 * update-then-select.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new PostgresJobStore(tableName);
  }

  @Override
  public Optional<Job> claim(Connection conn, String jobId, Instant startedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PROCESSING.code() + ", started_at=?" +
        " WHERE id=? AND status=" + JobStatus.PENDING.code() +
        " RETURNING " + COLUMNS;
    List<Job> claimed = JdbcTemplate.updateReturning(conn, sql, JOB_ROW_MAPPER, startedAt, jobId);
    return claimed.isEmpty() ? Optional.empty() : Optional.of(claimed.get(0));
  }
}
