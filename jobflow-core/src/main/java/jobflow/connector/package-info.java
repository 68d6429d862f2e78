/**
 * Connector envelope: deduplicated, retried and tracked delivery of processed data
 * to external destinations.
 */
package jobflow.connector;
