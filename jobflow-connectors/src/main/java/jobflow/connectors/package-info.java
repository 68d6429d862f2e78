/**
 * Concrete {@link jobflow.connector.Connector} implementations and their shared JSON setup.
 */
package jobflow.connectors;
