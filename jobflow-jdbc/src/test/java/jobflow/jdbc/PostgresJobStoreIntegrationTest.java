package jobflow.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobflow.jdbc.store.AbstractJdbcJobStore;
import jobflow.jdbc.store.PostgresJobStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class PostgresJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("jobflow_test");

  private static HikariDataSource dataSource;
  private final PostgresJobStore store = new PostgresJobStore();

  @BeforeAll
  static void initSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(postgres.getJdbcUrl());
    config.setUsername(postgres.getUsername());
    config.setPassword(postgres.getPassword());
    config.setMaximumPoolSize(4);
    config.setPoolName("jobflow-pg-test");
    dataSource = new HikariDataSource(config);
    SchemaScripts.apply(dataSource, "postgresql");
  }

  @AfterAll
  static void closePool() {
    if (dataSource != null) {
      dataSource.close();
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcJobStore store() {
    return store;
  }
}
