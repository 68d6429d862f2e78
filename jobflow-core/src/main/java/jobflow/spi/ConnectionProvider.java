package jobflow.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Supplies JDBC connections to the queue facade, the worker and the delivery tracker.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see jobflow.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
