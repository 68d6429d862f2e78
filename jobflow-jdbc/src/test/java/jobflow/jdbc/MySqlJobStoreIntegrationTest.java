package jobflow.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import jobflow.jdbc.store.AbstractJdbcJobStore;
import jobflow.jdbc.store.MySqlJobStore;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;

@DockerAvailable
@Testcontainers
class MySqlJobStoreIntegrationTest extends AbstractJobStoreIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("jobflow_test");

  private static HikariDataSource dataSource;
  private final MySqlJobStore store = new MySqlJobStore();

  @BeforeAll
  static void initSchema() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(mysql.getJdbcUrl());
    config.setUsername(mysql.getUsername());
    config.setPassword(mysql.getPassword());
    config.setMaximumPoolSize(4);
    config.setPoolName("jobflow-mysql-test");
    dataSource = new HikariDataSource(config);
    SchemaScripts.apply(dataSource, "mysql");
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
