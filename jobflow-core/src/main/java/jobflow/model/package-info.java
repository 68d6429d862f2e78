/**
 * Job records and their status, priority and aggregate views.
 */
package jobflow.model;
