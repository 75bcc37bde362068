package eventqueue.worker;

/**
 * Strategy for computing the delay before a failed event becomes eligible again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next claim.
     *
     * @param attempt the attempt that just failed (1-based, already incremented by the claim)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
