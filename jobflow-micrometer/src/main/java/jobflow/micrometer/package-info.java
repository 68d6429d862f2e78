/**
 * Micrometer integration for jobflow metrics.
 *
 * @see jobflow.micrometer.MicrometerMetricsExporter
 */
package jobflow.micrometer;
