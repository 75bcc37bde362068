package eventqueue;

/**
 * Unchecked exception for infrastructure failures (storage unavailable, SQL errors)
 * raised by queue operations.
 */
public class EventQueueException extends RuntimeException {
    public EventQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
