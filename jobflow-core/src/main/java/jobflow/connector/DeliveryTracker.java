package jobflow.connector;

import jobflow.JobRequest;
import jobflow.model.Job;
import jobflow.spi.ConnectionProvider;
import jobflow.spi.JobStore;
import jobflow.spi.JobStoreException;
import jobflow.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records connector deliveries as finished jobs so repeated deliveries can be skipped.
 *
 * <p>Each delivery becomes a job of type {@code DELIVERY_<TYPE>} for the subject, stored as
 * COMPLETED when it succeeded and FAILED otherwise. The result's fields are kept in the
 * job details; response data entries are prefixed with {@code response.}.
 *
 * <p>Database errors are logged. {@link #checkDelivered} then answers {@code false},
 * so a store outage leads to redelivery rather than lost data.
 */
public final class DeliveryTracker {
  private static final Logger logger = Logger.getLogger(DeliveryTracker.class.getName());

  public static final String OPERATION_PREFIX = "DELIVERY_";

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final MetricsExporter metrics;
  private final Clock clock;

  public DeliveryTracker(ConnectionProvider connectionProvider, JobStore jobStore) {
    this(connectionProvider, jobStore, MetricsExporter.NOOP, Clock.systemUTC());
  }

  public DeliveryTracker(ConnectionProvider connectionProvider, JobStore jobStore, MetricsExporter metrics) {
    this(connectionProvider, jobStore, metrics, Clock.systemUTC());
  }

  /**
   * @param clock stamps the creation, claim and completion times of delivery records
   */
  public DeliveryTracker(ConnectionProvider connectionProvider, JobStore jobStore, MetricsExporter metrics,
      Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /**
   * Returns the operation type under which deliveries of a connector type are recorded.
   */
  public static String operationType(String connectorType) {
    return OPERATION_PREFIX + connectorType.toUpperCase(Locale.ROOT);
  }

  /**
   * Records the outcome of a delivery.
   *
   * @return the ID of the job recording it, or empty if it could not be stored
   */
  public Optional<String> recordDelivery(String subjectId, String connectorType, DeliveryResult result) {
    metrics.recordDelivery(connectorType, result.success());
    Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
    JobRequest request = JobRequest.builder(subjectId, operationType(connectorType))
        .details(toDetails(connectorType, result))
        .createdAt(now)
        .build();
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        jobStore.insert(conn, request);
        Job claimed = jobStore.claim(conn, request.jobId(), now)
            .orElseThrow(() -> new JobStoreException("Delivery record " + request.jobId() + " vanished"));
        if (result.success()) {
          jobStore.markCompleted(conn, request.jobId(), claimed.startedAt(), result.deliveryId(), now);
        } else {
          jobStore.markFailed(conn, request.jobId(), claimed.startedAt(), result.error(), now);
        }
        conn.commit();
        return Optional.of(request.jobId());
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to record " + connectorType + " delivery for subject " + subjectId, e);
      return Optional.empty();
    }
  }

  /**
   * Checks whether the subject was successfully delivered by the connector type.
   */
  public boolean checkDelivered(String subjectId, String connectorType) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.existsCompleted(conn, subjectId, operationType(connectorType));
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to check " + connectorType + " delivery for subject " + subjectId, e);
      return false;
    }
  }

  /**
   * Returns delivery records of the subject across all connector types, newest first.
   */
  public List<Job> getDeliveryHistory(String subjectId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return jobStore.queryBySubject(conn, subjectId, OPERATION_PREFIX, limit);
    } catch (SQLException | JobStoreException e) {
      logger.log(Level.SEVERE, "Failed to load delivery history for subject " + subjectId, e);
      return List.of();
    }
  }

  private static Map<String, String> toDetails(String connectorType, DeliveryResult result) {
    Map<String, String> details = new LinkedHashMap<>();
    details.put("connector_type", connectorType);
    details.put("delivery_id", result.deliveryId());
    details.put("status", result.status().name());
    details.put("success", Boolean.toString(result.success()));
    details.put("retry_count", Integer.toString(result.retryCount()));
    details.put("duration_ms", Long.toString(result.durationMs()));
    if (result.deliveredAt() != null) {
      details.put("delivered_at", result.deliveredAt().toString());
    }
    if (result.responseCode() != null) {
      details.put("response_code", result.responseCode().toString());
    }
    if (result.error() != null) {
      details.put("error", result.error());
    }
    result.responseData().forEach((key, value) -> {
      if (value != null) {
        details.put("response." + key, value.toString());
      }
    });
    return details;
  }
}
