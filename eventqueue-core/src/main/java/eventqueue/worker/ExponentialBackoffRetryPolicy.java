package eventqueue.worker;

/**
 * Retry policy using deterministic exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^attempt}, capped at {@code maxDelay}. No jitter
 * is applied, so successive failures of one event always get non-decreasing delays.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    public static final long DEFAULT_BASE_DELAY_MS = 30_000L;
    public static final long DEFAULT_MAX_DELAY_MS = 3_600_000L;

    private final long baseDelayMs;
    private final long maxDelayMs;

    /**
     * @param baseDelayMs delay unit multiplied by {@code 2^attempt} (milliseconds)
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < 0) {
            throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * 30 seconds doubled per attempt, capped at one hour.
     */
    public static ExponentialBackoffRetryPolicy standard() {
        return new ExponentialBackoffRetryPolicy(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS);
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt < 0) {
            return 0L;
        }
        if (attempt >= 62) {
            return maxDelayMs;
        }
        long shift = 1L << attempt;
        // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
        if (shift > maxDelayMs / baseDelayMs) {
            return maxDelayMs;
        }
        return Math.min(maxDelayMs, baseDelayMs * shift);
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }
}
