package eventqueue.maintenance;

import eventqueue.EventQueueException;
import eventqueue.model.EventQuery;
import eventqueue.model.EventStatus;
import eventqueue.model.QueuedEvent;
import eventqueue.model.StatusCount;
import eventqueue.spi.ConnectionProvider;
import eventqueue.spi.EventQueueStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Out-of-band operations on the event table: pruning terminal rows, bulk retry of
 * dead-letter rows, and read-only inspection.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}. Unlike the
 * worker, failures are not swallowed: they surface as {@link EventQueueException} so an
 * operator tool can report them.
 *
 * @see CleanupScheduler
 */
public final class QueueMaintenance {
    private static final Logger logger = Logger.getLogger(QueueMaintenance.class.getName());

    public static final int DEFAULT_RETRY_LIMIT = 100;

    private final ConnectionProvider connectionProvider;
    private final EventQueueStore store;
    private final Clock clock;

    public QueueMaintenance(ConnectionProvider connectionProvider, EventQueueStore store) {
        this(connectionProvider, store, Clock.systemUTC());
    }

    public QueueMaintenance(ConnectionProvider connectionProvider, EventQueueStore store, Clock clock) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Deletes completed events whose {@code completed_at} is older than {@code olderThan}.
     * A negative age deletes every completed event.
     *
     * @return number of rows deleted
     */
    public int pruneCompleted(Duration olderThan) {
        Instant cutoff = cutoff(olderThan);
        int deleted = withConnection("prune completed events", conn -> store.deleteCompletedBefore(conn, cutoff));
        logger.log(Level.INFO, "Deleted {0} completed events older than {1}", new Object[]{deleted, cutoff});
        return deleted;
    }

    /**
     * Deletes dead-letter events whose {@code updated_at} is older than {@code olderThan}.
     *
     * @return number of rows deleted
     */
    public int pruneDeadLetter(Duration olderThan) {
        Instant cutoff = cutoff(olderThan);
        int deleted = withConnection("prune dead-letter events", conn -> store.deleteDeadLetterBefore(conn, cutoff));
        logger.log(Level.INFO, "Deleted {0} dead-letter events older than {1}", new Object[]{deleted, cutoff});
        return deleted;
    }

    /**
     * Resets up to {@code maxEvents} dead-letter events to {@code pending} with
     * {@code attempt = 0} and the error and claim columns cleared. Oldest first, in one transaction.
     *
     * @param eventType     optional event type filter ({@code null} for all)
     * @param consumerGroup optional consumer group filter ({@code null} for all)
     * @param maxEvents     upper bound on re-queued rows; {@code 0} or less re-queues nothing
     * @return number of rows re-queued
     */
    public int retryDeadLetter(String eventType, String consumerGroup, int maxEvents) {
        if (maxEvents <= 0) {
            return 0;
        }
        Instant now = clock.instant();
        int requeued = withConnection("retry dead-letter events", conn -> {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int count = 0;
                for (QueuedEvent event : store.queryDeadLetter(conn, eventType, consumerGroup, maxEvents)) {
                    count += store.requeueDeadLetter(conn, event.id(), now);
                }
                conn.commit();
                return count;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        });
        logger.log(Level.INFO, "Re-queued {0} dead-letter events (eventType={1}, consumerGroup={2})",
                new Object[]{requeued, eventType, consumerGroup});
        return requeued;
    }

    /**
     * Counts events by consumer group and status, ordered by both.
     */
    public List<StatusCount> queueStats() {
        return withConnection("read queue statistics", store::countByConsumerGroupAndStatus);
    }

    /**
     * Lists events matching {@code query}, newest first.
     */
    public List<QueuedEvent> listEvents(EventQuery query) {
        Objects.requireNonNull(query, "query");
        if (query.limit() == 0) {
            return List.of();
        }
        return withConnection("list events", conn -> store.listEvents(conn, query));
    }

    /**
     * Total number of events with the given status across all consumer groups.
     */
    public long countByStatus(EventStatus status) {
        Objects.requireNonNull(status, "status");
        return queueStats().stream()
                .filter(c -> c.status() == status)
                .mapToLong(StatusCount::count)
                .sum();
    }

    // A negative age puts the cutoff in the future and matches every terminal row
    private Instant cutoff(Duration olderThan) {
        Objects.requireNonNull(olderThan, "olderThan");
        return clock.instant().minus(olderThan);
    }

    private <T> T withConnection(String action, SqlFunction<T> work) {
        try (Connection conn = connectionProvider.getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to " + action, e);
            throw new EventQueueException("Failed to " + action, e);
        }
    }

    @FunctionalInterface
    private interface SqlFunction<T> {
        T apply(Connection conn) throws SQLException;
    }
}
