package eventqueue.spi;

import eventqueue.model.EventQuery;
import eventqueue.model.NewEvent;
import eventqueue.model.QueuedEvent;
import eventqueue.model.StatusCount;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for queued events, managing status transitions through the
 * lifecycle: pending → claimed → completed, claimed → pending (retry) or
 * claimed → dead_letter, and dead_letter → pending (manual retry).
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Every finalizing update is guarded on the row's current
 * status and returns the number of rows changed, so a row modified concurrently is
 * left untouched (0). Implementations live in the {@code eventqueue-jdbc} module.
 *
 * @see eventqueue.jdbc.store.AbstractJdbcEventQueueStore
 */
public interface EventQueueStore {

    /**
     * Inserts one event with status {@code pending}, {@code attempt = 0}.
     *
     * @param conn  the JDBC connection (typically within a transaction)
     * @param event the row to insert
     * @param now   creation timestamp
     * @return the database-assigned id
     */
    long insert(Connection conn, NewEvent event, Instant now);

    /**
     * Inserts several events and returns their ids in insertion order.
     *
     * <p>Default loops {@link #insert}.
     */
    default List<Long> insertAll(Connection conn, List<NewEvent> events, Instant now) {
        List<Long> ids = new ArrayList<>(events.size());
        for (NewEvent event : events) {
            ids.add(insert(conn, event, now));
        }
        return ids;
    }

    /**
     * Atomically claims up to {@code limit} due pending events of one consumer group.
     *
     * <p>Each claimed row gets {@code status = 'claimed'}, {@code claimed_by = workerId},
     * {@code claimed_at = now}, {@code attempt = attempt + 1} and {@code next_retry_at = NULL}.
     * Rows locked or claimed by a concurrent transaction are never returned. Must run
     * inside a transaction the caller commits before processing.
     *
     * @param conn          the JDBC connection with auto-commit disabled
     * @param consumerGroup the consumer group to claim for
     * @param workerId      identity of the claiming worker instance
     * @param now           current time; rows with {@code next_retry_at <= now} or null are due
     * @param limit         maximum number of events to claim
     * @return claimed events in id order
     */
    List<QueuedEvent> claimPending(Connection conn, String consumerGroup, String workerId,
            Instant now, int limit);

    /**
     * Reads one event by id.
     */
    Optional<QueuedEvent> findById(Connection conn, long id);

    /**
     * Transitions a claimed event to {@code completed}. Clears the claim columns.
     *
     * @param resultJson optional result document (may be {@code null})
     * @return the number of rows updated (0 if the event is no longer claimed)
     */
    int markCompleted(Connection conn, long id, String resultJson, Instant now);

    /**
     * Returns a claimed event to {@code pending} after a failure, recording the error and
     * the earliest time it may be claimed again. Clears the claim columns.
     *
     * @return the number of rows updated (0 if the event is no longer claimed)
     */
    int markRetry(Connection conn, long id, String error, Instant nextRetryAt, Instant now);

    /**
     * Moves a claimed event to {@code dead_letter}, recording the error. Clears the claim columns.
     *
     * @return the number of rows updated (0 if the event is no longer claimed)
     */
    int markDeadLetter(Connection conn, long id, String error, Instant now);

    /**
     * Queries dead-letter events with optional filters, oldest first.
     *
     * @param eventType     optional event type filter ({@code null} for all)
     * @param consumerGroup optional consumer group filter ({@code null} for all)
     * @param limit         maximum number of events to return
     */
    List<QueuedEvent> queryDeadLetter(Connection conn, String eventType, String consumerGroup, int limit);

    /**
     * Resets a dead-letter event to {@code pending} with {@code attempt = 0} and
     * {@code error}, {@code claimed_by}, {@code claimed_at}, {@code next_retry_at} cleared.
     *
     * @return the number of rows updated (0 if the event does not exist or is not dead-lettered)
     */
    int requeueDeadLetter(Connection conn, long id, Instant now);

    /**
     * Deletes completed events whose {@code completed_at} is before {@code cutoff}.
     */
    int deleteCompletedBefore(Connection conn, Instant cutoff);

    /**
     * Deletes dead-letter events whose {@code updated_at} is before {@code cutoff}.
     */
    int deleteDeadLetterBefore(Connection conn, Instant cutoff);

    /**
     * Counts events grouped by consumer group and status, ordered by both.
     */
    List<StatusCount> countByConsumerGroupAndStatus(Connection conn);

    /**
     * Lists events matching the query, newest first.
     */
    List<QueuedEvent> listEvents(Connection conn, EventQuery query);
}
