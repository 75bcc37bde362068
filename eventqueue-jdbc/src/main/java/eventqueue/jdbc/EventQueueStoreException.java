package eventqueue.jdbc;

import eventqueue.EventQueueException;

/**
 * Unchecked exception wrapping JDBC errors thrown by
 * {@link eventqueue.jdbc.store.AbstractJdbcEventQueueStore} and its subclasses.
 */
public final class EventQueueStoreException extends EventQueueException {
    public EventQueueStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
