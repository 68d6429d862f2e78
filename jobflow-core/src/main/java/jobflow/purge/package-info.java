/**
 * Scheduled removal of old COMPLETED jobs.
 */
package jobflow.purge;
