/**
 * Polling worker: claims eligible jobs, runs their handlers under bounded
 * concurrency and a per-job timeout, and records retry, dead-letter and
 * completion outcomes.
 */
package jobflow.worker;
