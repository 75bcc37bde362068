package eventqueue.jdbc.store;

import eventqueue.jdbc.Schemas;
import eventqueue.model.EventQuery;
import eventqueue.model.EventStatus;
import eventqueue.model.NewEvent;
import eventqueue.model.QueuedEvent;
import eventqueue.model.StatusCount;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class H2EventQueueStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcDataSource dataSource;
    private H2EventQueueStore store;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = Schemas.h2();
        store = new H2EventQueueStore();
    }

    @Test
    void insertCreatesPendingRow() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long id = store.insert(conn, event("analyzer", 3), T0);

            QueuedEvent row = store.findById(conn, id).orElseThrow();
            assertEquals(EventStatus.PENDING, row.status());
            assertEquals("signals_stored", row.eventType());
            assertEquals("analyzer", row.consumerGroup());
            assertEquals("{\"ticker\":\"NVDA\"}", row.payloadJson());
            assertEquals(0, row.attempt());
            assertEquals(3, row.maxAttempts());
            assertEquals("corr-1", row.correlationId());
            assertEquals("harvester", row.sourceService());
            assertEquals(T0, row.createdAt());
            assertEquals(T0, row.updatedAt());
            assertNull(row.claimedBy());
            assertNull(row.nextRetryAt());
        }
    }

    @Test
    void insertAllReturnsIdsInOrder() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            List<Long> ids = store.insertAll(conn, List.of(event("analyzer", 3), event("notifications", 3)), T0);

            assertEquals(2, ids.size());
            assertTrue(ids.get(0) < ids.get(1));
        }
    }

    @Test
    void claimStampsOwnerAndIncrementsAttempt() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long first = store.insert(conn, event("analyzer", 3), T0);
            long second = store.insert(conn, event("analyzer", 3), T0);
            store.insert(conn, event("notifications", 3), T0);

            List<QueuedEvent> claimed = store.claimPending(conn, "analyzer", "w-1", T0.plusSeconds(1), 10);

            assertEquals(List.of(first, second), claimed.stream().map(QueuedEvent::id).toList());
            for (QueuedEvent row : claimed) {
                assertEquals(EventStatus.CLAIMED, row.status());
                assertEquals("w-1", row.claimedBy());
                assertEquals(T0.plusSeconds(1), row.claimedAt());
                assertEquals(1, row.attempt());
            }
        }
    }

    @Test
    void claimRespectsLimitAndSkipsClaimedRows() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < 3; i++) {
                store.insert(conn, event("analyzer", 3), T0);
            }

            assertEquals(2, store.claimPending(conn, "analyzer", "w-1", T0, 2).size());
            assertEquals(1, store.claimPending(conn, "analyzer", "w-2", T0.plusMillis(5), 2).size());
            assertTrue(store.claimPending(conn, "analyzer", "w-3", T0.plusMillis(10), 2).isEmpty());
        }
    }

    @Test
    void claimSkipsRowsWithFutureRetry() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long id = store.insert(conn, event("analyzer", 3), T0);
            store.claimPending(conn, "analyzer", "w-1", T0, 1);
            assertEquals(1, store.markRetry(conn, id, "boom", T0.plusSeconds(60), T0));

            assertTrue(store.claimPending(conn, "analyzer", "w-1", T0.plusSeconds(59), 1).isEmpty());

            List<QueuedEvent> due = store.claimPending(conn, "analyzer", "w-1", T0.plusSeconds(60), 1);
            assertEquals(1, due.size());
            assertEquals(2, due.get(0).attempt());
            assertNull(due.get(0).nextRetryAt());
        }
    }

    @Test
    void finalizingUpdatesAreGuardedOnClaimedStatus() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long id = store.insert(conn, event("analyzer", 3), T0);

            assertEquals(0, store.markCompleted(conn, id, "{}", T0));
            assertEquals(0, store.markRetry(conn, id, "x", T0, T0));
            assertEquals(0, store.markDeadLetter(conn, id, "x", T0));

            store.claimPending(conn, "analyzer", "w-1", T0, 1);
            assertEquals(1, store.markCompleted(conn, id, "{\"ok\":true}", T0.plusSeconds(2)));
            assertEquals(0, store.markDeadLetter(conn, id, "late", T0.plusSeconds(3)));

            QueuedEvent row = store.findById(conn, id).orElseThrow();
            assertEquals(EventStatus.COMPLETED, row.status());
            assertEquals("{\"ok\":true}", row.resultJson());
            assertEquals(T0.plusSeconds(2), row.completedAt());
            assertNull(row.claimedBy());
            assertNull(row.claimedAt());
        }
    }

    @Test
    void deadLetterAndRequeueCycle() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long id = store.insert(conn, event("analyzer", 1), T0);
            store.claimPending(conn, "analyzer", "w-1", T0, 1);
            assertEquals(1, store.markDeadLetter(conn, id, "fatal", T0.plusSeconds(1)));

            List<QueuedEvent> dead = store.queryDeadLetter(conn, "signals_stored", "analyzer", 10);
            assertEquals(1, dead.size());
            assertEquals("fatal", dead.get(0).error());
            assertTrue(store.queryDeadLetter(conn, "posts_harvested", null, 10).isEmpty());

            assertEquals(1, store.requeueDeadLetter(conn, id, T0.plusSeconds(5)));
            assertEquals(0, store.requeueDeadLetter(conn, id, T0.plusSeconds(5)));

            QueuedEvent row = store.findById(conn, id).orElseThrow();
            assertEquals(EventStatus.PENDING, row.status());
            assertEquals(0, row.attempt());
            assertNull(row.error());
            assertEquals(T0.plusSeconds(5), row.updatedAt());
        }
    }

    @Test
    void longErrorsAreTruncated() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long id = store.insert(conn, event("analyzer", 1), T0);
            store.claimPending(conn, "analyzer", "w-1", T0, 1);
            store.markDeadLetter(conn, id, "e".repeat(5000), T0);

            String error = store.findById(conn, id).orElseThrow().error();
            assertEquals(4000, error.length());
            assertTrue(error.endsWith("..."));
        }
    }

    @Test
    void deletesTerminalRowsOlderThanCutoff() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            long done = store.insert(conn, event("analyzer", 1), T0);
            long dead = store.insert(conn, event("analyzer", 1), T0);
            long pending = store.insert(conn, event("notifications", 1), T0);
            store.claimPending(conn, "analyzer", "w-1", T0, 2);
            store.markCompleted(conn, done, null, T0);
            store.markDeadLetter(conn, dead, "x", T0);

            Instant cutoff = T0.plus(Duration.ofDays(1));
            assertEquals(1, store.deleteCompletedBefore(conn, cutoff));
            assertEquals(1, store.deleteDeadLetterBefore(conn, cutoff));
            assertEquals(0, store.deleteCompletedBefore(conn, cutoff));
            assertTrue(store.findById(conn, pending).isPresent());
        }
    }

    @Test
    void countsAndListsEvents() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            store.insert(conn, event("analyzer", 3), T0);
            store.insert(conn, event("analyzer", 3), T0.plusSeconds(1));
            long last = store.insert(conn, event("notifications", 3), T0.plusSeconds(2));

            List<StatusCount> counts = store.countByConsumerGroupAndStatus(conn);
            assertEquals(List.of(
                    new StatusCount("analyzer", EventStatus.PENDING, 2),
                    new StatusCount("notifications", EventStatus.PENDING, 1)), counts);

            List<QueuedEvent> recent = store.listEvents(conn, EventQuery.builder().limit(2).build());
            assertEquals(2, recent.size());
            assertEquals(last, recent.get(0).id());

            List<QueuedEvent> filtered = store.listEvents(conn,
                    EventQuery.builder().consumerGroup("analyzer").status(EventStatus.PENDING).build());
            assertEquals(2, filtered.size());
            assertNotNull(filtered.get(0).createdAt());
        }
    }

    @Test
    void withTableNameReturnsCopyBoundToTable() {
        AbstractJdbcEventQueueStore custom = store.withTableName("pipeline_events");
        assertEquals("pipeline_events", custom.tableName());
        assertEquals("h2", custom.name());
        assertEquals("events", store.tableName());
    }

    private static NewEvent event(String consumerGroup, int maxAttempts) {
        return new NewEvent("signals_stored", consumerGroup, "{\"ticker\":\"NVDA\"}", "harvester", "corr-1", maxAttempts);
    }
}
