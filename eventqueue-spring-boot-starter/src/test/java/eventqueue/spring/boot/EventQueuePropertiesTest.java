package eventqueue.spring.boot;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventQueuePropertiesTest {

    @Test
    void defaults() {
        EventQueueProperties props = new EventQueueProperties();

        assertEquals("events", props.getTableName());
        assertTrue(props.getRegistry().getEventTypes().isEmpty());
        assertTrue(props.getWorker().isEnabled());
        assertEquals(Duration.ofSeconds(2), props.getWorker().getPollInterval());
        assertEquals(10, props.getWorker().getBatchSize());
        assertEquals(Duration.ofSeconds(30), props.getWorker().getDrainTimeout());
        assertEquals(Duration.ofSeconds(30), props.getRetry().getBaseDelay());
        assertEquals(Duration.ofHours(1), props.getRetry().getMaxDelay());
        assertFalse(props.getCleanup().isEnabled());
        assertEquals(Duration.ofDays(7), props.getCleanup().getCompletedRetention());
        assertEquals(Duration.ofDays(30), props.getCleanup().getDeadLetterRetention());
        assertEquals(Duration.ofHours(1), props.getCleanup().getInterval());
        assertTrue(props.getMetrics().isEnabled());
        assertEquals("eventqueue", props.getMetrics().getNamePrefix());
    }
}
