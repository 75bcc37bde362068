package eventqueue.registry;

import java.util.Collection;

/**
 * Thrown when an event type is emitted that the {@link ConsumerRegistry} does not know.
 * This is a configuration error: nothing is written.
 */
public class UnknownEventTypeException extends IllegalArgumentException {
    private final String eventType;

    public UnknownEventTypeException(String eventType, Collection<String> registeredTypes) {
        super("Unknown event type: " + eventType + ". Registered types: " + registeredTypes);
        this.eventType = eventType;
    }

    public String eventType() {
        return eventType;
    }
}
