package eventqueue.model;

import java.time.Instant;

/**
 * Read-only record representing a persisted event row, as returned by the store
 * when claiming, re-reading or listing events.
 *
 * <p>{@code payloadJson} and {@code resultJson} are opaque JSON documents; the queue
 * never looks inside them.
 *
 * @see eventqueue.spi.EventQueueStore#claimPending
 * @see eventqueue.spi.EventQueueStore#findById
 */
public record QueuedEvent(
        long id,
        String eventType,
        String consumerGroup,
        String payloadJson,
        EventStatus status,
        String claimedBy,
        Instant claimedAt,
        Instant completedAt,
        String resultJson,
        String error,
        int attempt,
        int maxAttempts,
        Instant nextRetryAt,
        String sourceService,
        String correlationId,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Returns {@code true} if a poll executed at {@code now} may claim this row.
     * A {@code null} {@code nextRetryAt} is always due.
     */
    public boolean isDue(Instant now) {
        return status == EventStatus.PENDING && (nextRetryAt == null || !nextRetryAt.isAfter(now));
    }
}
