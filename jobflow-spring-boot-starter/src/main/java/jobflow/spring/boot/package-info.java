/**
 * Spring Boot auto-configuration for the job queue, worker and delivery tracking.
 *
 * <p>Add this module to a Boot application with a {@link javax.sql.DataSource} and annotate
 * handler beans with {@link jobflow.spring.boot.JobHandlerFor}. All settings live under the
 * {@code jobflow} prefix, see {@link jobflow.spring.boot.JobflowProperties}.
 */
package jobflow.spring.boot;
