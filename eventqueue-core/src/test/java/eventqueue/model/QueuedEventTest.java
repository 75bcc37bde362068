package eventqueue.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class QueuedEventTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private static QueuedEvent row(EventStatus status, Instant nextRetryAt) {
        return new QueuedEvent(1L, "signals_stored", "analyzer", "{}", status, null, null, null, null, null,
                0, 3, nextRetryAt, "test", "corr-1", NOW, NOW);
    }

    @Test
    void nullNextRetryAtIsAlwaysDue() {
        assertTrue(row(EventStatus.PENDING, null).isDue(NOW));
    }

    @Test
    void dueAtExactlyNextRetryAt() {
        assertTrue(row(EventStatus.PENDING, NOW).isDue(NOW));
        assertFalse(row(EventStatus.PENDING, NOW.plusMillis(1)).isDue(NOW));
    }

    @Test
    void onlyPendingRowsAreDue() {
        assertFalse(row(EventStatus.CLAIMED, null).isDue(NOW));
        assertFalse(row(EventStatus.DEAD_LETTER, null).isDue(NOW));
    }

    @Test
    void statusCodesRoundTrip() {
        for (EventStatus status : EventStatus.values()) {
            assertSame(status, EventStatus.fromCode(status.code()));
        }
        assertEquals("dead_letter", EventStatus.DEAD_LETTER.code());
        assertThrows(IllegalArgumentException.class, () -> EventStatus.fromCode("done"));
    }

    @Test
    void terminalStates() {
        assertTrue(EventStatus.COMPLETED.isTerminal());
        assertTrue(EventStatus.DEAD_LETTER.isTerminal());
        assertFalse(EventStatus.FAILED.isTerminal());
        assertFalse(EventStatus.PENDING.isTerminal());
    }

    @Test
    void eventQueryDefaultsAndValidation() {
        EventQuery query = EventQuery.recent();
        assertEquals(EventQuery.DEFAULT_LIMIT, query.limit());
        assertNull(query.status());
        assertEquals(0, EventQuery.builder().limit(0).build().limit());
        assertThrows(IllegalArgumentException.class, () -> EventQuery.builder().limit(-1).build());
    }

    @Test
    void newEventRejectsZeroAttempts() {
        assertThrows(IllegalArgumentException.class,
                () -> new NewEvent("signals_stored", "analyzer", "{}", "test", "corr", 0));
    }
}
