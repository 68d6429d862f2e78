/**
 * JDBC support for jobflow: connection providers, the {@link jobflow.jdbc.JdbcTemplate}
 * helper and the bundled schema scripts.
 *
 * @see jobflow.jdbc.store.AbstractJdbcJobStore
 */
package jobflow.jdbc;
