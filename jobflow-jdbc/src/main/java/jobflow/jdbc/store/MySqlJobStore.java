package jobflow.jdbc.store;

import jobflow.jdbc.JdbcTemplate;
import jobflow.model.JobStatus;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * MySQL job store. Also compatible with TiDB.
 *
 * <p>MySQL rejects {@code LIMIT} inside an {@code IN} subquery on the table being
 * deleted from, so purging uses {@code DELETE...ORDER BY...LIMIT} directly.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(String tableName) {
    super(tableName);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public AbstractJdbcJobStore withTableName(String tableName) {
    return new MySqlJobStore(tableName);
  }

  @Override
  public int deleteCompletedBefore(Connection conn, Instant cutoff, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status=" + JobStatus.COMPLETED.code() + " AND completed_at < ?" +
        " ORDER BY completed_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, cutoff, limit);
  }
}
