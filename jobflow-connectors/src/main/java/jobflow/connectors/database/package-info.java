/**
 * Export of delivered subjects into rows of an external JDBC table.
 */
package jobflow.connectors.database;
