/**
 * Service provider interfaces: job persistence, connection supply and metrics export.
 */
package jobflow.spi;
