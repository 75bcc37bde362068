/**
 * Claim-and-process worker, failure transitions and retry backoff.
 *
 * <h2>Lifecycle of a row</h2>
 * <pre>
 * pending --claim--> claimed --success--> completed
 *                            --failure--> pending (attempt &lt; max_attempts, next_retry_at = now + backoff)
 *                            --failure--> dead_letter (attempt &gt;= max_attempts)
 * dead_letter --manual retry--> pending
 * </pre>
 *
 * @see eventqueue.worker.EventWorker
 * @see eventqueue.worker.EventTransitions
 */
package eventqueue.worker;
