package jobflow.jdbc.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jobflow.JobRequest;
import jobflow.jdbc.JdbcTemplate;
import jobflow.jdbc.TableNames;
import jobflow.model.Job;
import jobflow.model.JobPriority;
import jobflow.model.JobStatus;
import jobflow.spi.JobStore;
import jobflow.spi.JobStoreException;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Base JDBC job store with standard SQL implementations.
 *
 * <p>Jobs live in one table (default {@value TableNames#DEFAULT_TABLE}) and dependency
 * edges in a companion {@code <table>_dependency} table. Caller-supplied details are
 * stored as a JSON object in the {@code details} column.
 *
 * <p>Subclasses override {@link #claim} or {@link #deleteCompletedBefore} where the
 * database offers something better than the portable SQL. Register custom
 * implementations via {@code META-INF/services/jobflow.jdbc.store.AbstractJdbcJobStore}.
 *
 * @see JdbcJobStores
 */
public abstract class AbstractJdbcJobStore implements JobStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<Map<String, String>> DETAILS_TYPE = new TypeReference<>() {};

  protected static final String COLUMNS = "id, subject_id, operation_type, tenant_id, status, priority, " +
      "idempotency_key, retry_count, last_error, retry_after, details, error, result, " +
      "created_at, started_at, completed_at";

  protected static final String TERMINAL_STATUS_IN = "(" + JobStatus.COMPLETED.code() + "," +
      JobStatus.FAILED.code() + "," + JobStatus.CANCELLED.code() + "," + JobStatus.DEAD_LETTER.code() + ")";

  protected static final String RESETTABLE_STATUS_IN =
      "(" + JobStatus.FAILED.code() + "," + JobStatus.DEAD_LETTER.code() + ")";

  protected static final String NOT_LIVE_STATUS_IN =
      "(" + JobStatus.CANCELLED.code() + "," + JobStatus.DEAD_LETTER.code() + ")";

  /** Matches the row only while it is still held by the claim that stamped {@code started_at}. */
  protected static final String CLAIMED_BY =
      " WHERE id=? AND status=" + JobStatus.PROCESSING.code() + " AND started_at=?";

  protected static final JdbcTemplate.RowMapper<Job> JOB_ROW_MAPPER = rs -> new Job(
      rs.getString("id"),
      rs.getString("subject_id"),
      rs.getString("operation_type"),
      rs.getString("tenant_id"),
      JobStatus.fromCode(rs.getInt("status")),
      JobPriority.fromValue(rs.getInt("priority")),
      rs.getString("idempotency_key"),
      rs.getInt("retry_count"),
      rs.getString("last_error"),
      JdbcTemplate.toInstant(rs.getTimestamp("retry_after")),
      readDetails(rs.getString("details")),
      rs.getString("error"),
      rs.getString("result"),
      rs.getTimestamp("created_at").toInstant(),
      JdbcTemplate.toInstant(rs.getTimestamp("started_at")),
      JdbcTemplate.toInstant(rs.getTimestamp("completed_at")));

  private final String tableName;
  private final String dependencyTable;

  protected AbstractJdbcJobStore() {
    this(TableNames.DEFAULT_TABLE);
  }

  protected AbstractJdbcJobStore(String tableName) {
    this.tableName = TableNames.validate(tableName);
    this.dependencyTable = TableNames.dependencyTable(tableName);
  }

  /**
   * Unique identifier for this job store (e.g., "mysql", "postgresql", "h2").
   * Also selects the bundled schema script.
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this job store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a store of the same kind bound to another job table.
   */
  public abstract AbstractJdbcJobStore withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  protected String dependencyTable() {
    return dependencyTable;
  }

  // ── Writes ───────────────────────────────────────────────────────

  @Override
  public void insert(Connection conn, JobRequest request) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ")" +
        " VALUES (?,?,?,?,?,?,?,0,NULL,NULL,?,NULL,NULL,?,NULL,NULL)";
    JdbcTemplate.update(conn, sql,
        request.jobId(), request.subjectId(), request.operationType(), request.tenantId(),
        JobStatus.PENDING.code(), request.priority().value(), request.idempotencyKey(),
        writeDetails(request.details()), request.createdAt());
  }

  @Override
  public void insertDependencies(Connection conn, String jobId, Collection<String> dependsOn) {
    Objects.requireNonNull(jobId, "jobId");
    String sql = "INSERT INTO " + dependencyTable() + " (job_id, depends_on) VALUES (?,?)";
    for (String dependency : new LinkedHashSet<>(dependsOn)) {
      JdbcTemplate.update(conn, sql, jobId, dependency);
    }
  }

  @Override
  public Optional<Job> claim(Connection conn, String jobId, Instant startedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PROCESSING.code() + ", started_at=?" +
        " WHERE id=? AND status=" + JobStatus.PENDING.code();
    int updated = JdbcTemplate.update(conn, sql, startedAt, jobId);
    if (updated == 0) {
      return Optional.empty();
    }
    return findById(conn, jobId);
  }

  @Override
  public int markCompleted(Connection conn, String jobId, Instant claimedAt, String result, Instant completedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.COMPLETED.code() + ", result=?, completed_at=?" +
        CLAIMED_BY;
    return JdbcTemplate.update(conn, sql, result, completedAt, jobId, claimedAt);
  }

  @Override
  public int markFailed(Connection conn, String jobId, Instant claimedAt, String error, Instant completedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.FAILED.code() + ", error=?, completed_at=?" +
        CLAIMED_BY;
    return JdbcTemplate.update(conn, sql, truncateError(error), completedAt, jobId, claimedAt);
  }

  @Override
  public int markRetry(Connection conn, String jobId, Instant claimedAt, Instant retryAfter, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PENDING.code() +
        ", retry_count=retry_count+1, last_error=?, retry_after=?, started_at=NULL" +
        CLAIMED_BY;
    return JdbcTemplate.update(conn, sql, truncateError(error), retryAfter, jobId, claimedAt);
  }

  @Override
  public int markDeadLetter(Connection conn, String jobId, Instant claimedAt, String error, Instant completedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.DEAD_LETTER.code() + ", error=?, completed_at=?" +
        CLAIMED_BY;
    return JdbcTemplate.update(conn, sql, truncateError(error), completedAt, jobId, claimedAt);
  }

  @Override
  public int cancel(Connection conn, String jobId, Instant completedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.CANCELLED.code() + ", completed_at=?" +
        " WHERE id=? AND status=" + JobStatus.PENDING.code();
    return JdbcTemplate.update(conn, sql, completedAt, jobId);
  }

  @Override
  public int resetForRetry(Connection conn, String jobId, boolean resetRetryCount) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PENDING.code() +
        ", error=NULL, completed_at=NULL, retry_after=NULL, started_at=NULL" +
        (resetRetryCount ? ", retry_count=0" : "") +
        " WHERE id=? AND status IN " + RESETTABLE_STATUS_IN;
    return JdbcTemplate.update(conn, sql, jobId);
  }

  @Override
  public int deadLetterStale(Connection conn, Instant cutoff, int maxRetries, String error, Instant completedAt) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.DEAD_LETTER.code() + ", error=?, completed_at=?" +
        " WHERE status=" + JobStatus.PROCESSING.code() + " AND started_at < ? AND retry_count >= ?";
    return JdbcTemplate.update(conn, sql, truncateError(error), completedAt, cutoff, maxRetries);
  }

  @Override
  public int requeueStale(Connection conn, Instant cutoff, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + JobStatus.PENDING.code() +
        ", retry_count=retry_count+1, last_error=?, retry_after=NULL, started_at=NULL" +
        " WHERE status=" + JobStatus.PROCESSING.code() + " AND started_at < ?";
    return JdbcTemplate.update(conn, sql, truncateError(error), cutoff);
  }

  /**
   * Deletes old COMPLETED jobs through an {@code IN (SELECT ... LIMIT ?)} subquery.
   * Dependency edges go with them through {@code ON DELETE CASCADE}.
   */
  @Override
  public int deleteCompletedBefore(Connection conn, Instant cutoff, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE id IN (" +
        "SELECT id FROM " + tableName() +
        " WHERE status=" + JobStatus.COMPLETED.code() + " AND completed_at < ?" +
        " ORDER BY completed_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, cutoff, limit);
  }

  // ── Reads ────────────────────────────────────────────────────────

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, jobId));
  }

  @Override
  public Optional<Job> findLiveByIdempotencyKey(Connection conn, String idempotencyKey) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE idempotency_key=? AND status NOT IN " + NOT_LIVE_STATUS_IN +
        " ORDER BY created_at DESC LIMIT 1";
    return first(JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, idempotencyKey));
  }

  @Override
  public List<String> findDependencies(Connection conn, String jobId) {
    String sql = "SELECT depends_on FROM " + dependencyTable() + " WHERE job_id=? ORDER BY depends_on";
    return JdbcTemplate.query(conn, sql, rs -> rs.getString(1), jobId);
  }

  @Override
  public List<Job> pollPending(Connection conn, Collection<String> operationTypes, Instant now, int limit) {
    if (operationTypes.isEmpty()) {
      return List.of();
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " j" +
        " WHERE j.status=" + JobStatus.PENDING.code() +
        " AND j.operation_type IN (" + placeholders(operationTypes.size()) + ")" +
        " AND (j.retry_after IS NULL OR j.retry_after <= ?)" +
        " AND NOT EXISTS (SELECT 1 FROM " + dependencyTable() + " d" +
        " JOIN " + tableName() + " p ON p.id = d.depends_on" +
        " WHERE d.job_id = j.id AND p.status <> " + JobStatus.COMPLETED.code() + ")" +
        " ORDER BY j.created_at, j.id LIMIT ?";
    List<Object> params = new ArrayList<>(operationTypes);
    params.add(now);
    params.add(limit);
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, params.toArray());
  }

  @Override
  public List<Job> queryByStatus(Connection conn, JobStatus status, String operationType, int limit) {
    boolean terminal = status != JobStatus.PENDING && status != JobStatus.PROCESSING;
    String order = terminal ? " ORDER BY completed_at DESC, id DESC" : " ORDER BY created_at, id";
    if (operationType == null) {
      String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
          " WHERE status=?" + order + " LIMIT ?";
      return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, status.code(), limit);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=? AND operation_type=?" + order + " LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, status.code(), operationType, limit);
  }

  @Override
  public Map<JobStatus, Map<String, Integer>> countByStatusAndType(Connection conn) {
    String sql = "SELECT status, operation_type, COUNT(*) AS cnt FROM " + tableName() +
        " GROUP BY status, operation_type";
    Map<JobStatus, Map<String, Integer>> counts = new EnumMap<>(JobStatus.class);
    JdbcTemplate.query(conn, sql, rs -> {
      counts.computeIfAbsent(JobStatus.fromCode(rs.getInt("status")), s -> new TreeMap<>())
          .put(rs.getString("operation_type"), rs.getInt("cnt"));
      return null;
    });
    return counts;
  }

  @Override
  public boolean existsCompleted(Connection conn, String subjectId, String operationType) {
    String sql = "SELECT 1 FROM " + tableName() +
        " WHERE subject_id=? AND operation_type=? AND status=" + JobStatus.COMPLETED.code() + " LIMIT 1";
    return !JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), subjectId, operationType).isEmpty();
  }

  @Override
  public List<Job> queryBySubject(Connection conn, String subjectId, String typePrefix, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE subject_id=? AND operation_type LIKE ? ESCAPE '!'" +
        " ORDER BY created_at DESC, id DESC LIMIT ?";
    return JdbcTemplate.query(conn, sql, JOB_ROW_MAPPER, subjectId, likePrefix(typePrefix), limit);
  }

  // ── Helpers ──────────────────────────────────────────────────────

  protected static String truncateError(String error) {
    if (error == null) return null;
    return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
  }

  protected static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }

  static String likePrefix(String prefix) {
    String escaped = prefix.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    return escaped + "%";
  }

  static String writeDetails(Map<String, String> details) {
    if (details == null || details.isEmpty()) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(new TreeMap<>(details));
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to serialize job details", e);
    }
  }

  static Map<String, String> readDetails(String json) {
    if (json == null || json.isEmpty()) {
      return Map.of();
    }
    try {
      return MAPPER.readValue(json, DETAILS_TYPE);
    } catch (JsonProcessingException e) {
      throw new JobStoreException("Failed to parse job details: " + json, e);
    }
  }

  private static <T> Optional<T> first(List<T> rows) {
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }
}
