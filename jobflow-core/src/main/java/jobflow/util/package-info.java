/**
 * Threading and timing utilities shared by the worker, the rate limiter and connectors.
 */
package jobflow.util;
