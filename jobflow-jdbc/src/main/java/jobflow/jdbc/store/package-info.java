/**
 * JDBC-based {@link jobflow.spi.JobStore} implementations.
 *
 * <p>{@link jobflow.jdbc.store.AbstractJdbcJobStore} provides shared SQL and row mapping;
 * subclasses handle database quirks: PostgreSQL claims with {@code UPDATE ... RETURNING},
 * MySQL purges with {@code DELETE ... ORDER BY ... LIMIT}.
 *
 * @see jobflow.jdbc.store.JdbcJobStores
 */
package jobflow.jdbc.store;
