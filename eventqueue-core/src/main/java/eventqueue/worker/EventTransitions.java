package eventqueue.worker;

import eventqueue.model.QueuedEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * Decides where a claimed event goes after its consumer fails.
 *
 * <p>While {@code attempt < maxAttempts} the event returns to {@code pending} with
 * {@code next_retry_at = failedAt + backoff(attempt)}; otherwise it is dead-lettered.
 * The store applies the outcome with an update guarded on {@code status = 'claimed'}.
 */
public final class EventTransitions {

    /** Outcome of a failed processing attempt. */
    public sealed interface FailureOutcome permits Retry, DeadLetter {
    }

    /**
     * The event goes back to {@code pending} and becomes claimable at {@code nextRetryAt}.
     */
    public record Retry(Instant nextRetryAt) implements FailureOutcome {
        public Retry {
            Objects.requireNonNull(nextRetryAt, "nextRetryAt");
        }
    }

    /** Attempts are exhausted; the event stops being polled. */
    public record DeadLetter() implements FailureOutcome {
    }

    private static final DeadLetter DEAD_LETTER = new DeadLetter();

    private EventTransitions() {}

    /**
     * Computes the transition for a failed attempt.
     *
     * @param event       the claimed event (its {@code attempt} already counts this try)
     * @param failedAt    when the failure was observed
     * @param retryPolicy backoff strategy
     * @return {@link Retry} or {@link DeadLetter}
     */
    public static FailureOutcome onFailure(QueuedEvent event, Instant failedAt, RetryPolicy retryPolicy) {
        return onFailure(event.attempt(), event.maxAttempts(), failedAt, retryPolicy);
    }

    public static FailureOutcome onFailure(int attempt, int maxAttempts, Instant failedAt,
            RetryPolicy retryPolicy) {
        Objects.requireNonNull(failedAt, "failedAt");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        if (attempt >= maxAttempts) {
            return DEAD_LETTER;
        }
        long delayMs = Math.max(0L, retryPolicy.computeDelayMs(attempt));
        return new Retry(failedAt.plusMillis(delayMs));
    }
}
