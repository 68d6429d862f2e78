/**
 * CSV file export with daily and size-based rotation, written with jackson-dataformat-csv.
 */
package jobflow.connectors.csv;
