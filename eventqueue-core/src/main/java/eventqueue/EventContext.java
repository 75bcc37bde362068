package eventqueue;

import eventqueue.model.QueuedEvent;

import java.util.Map;
import java.util.Objects;

/**
 * What a consumer sees of one claimed event: the decoded payload plus the provenance
 * needed to emit downstream events on the same correlation id.
 *
 * @param eventId       database id of the row
 * @param eventType     event type
 * @param consumerGroup the consumer group this copy belongs to
 * @param payload       decoded payload document
 * @param attempt       current attempt, starting at 1
 * @param maxAttempts   attempts allowed before dead-letter
 * @param correlationId shared id of the originating occurrence
 * @param sourceService producer that created the row (may be {@code null})
 */
public record EventContext(
        long eventId,
        String eventType,
        String consumerGroup,
        Map<String, Object> payload,
        int attempt,
        int maxAttempts,
        String correlationId,
        String sourceService
) {

    public EventContext {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(consumerGroup, "consumerGroup");
        Objects.requireNonNull(payload, "payload");
    }

    /** Builds the context for a claimed row and its decoded payload. */
    public static EventContext of(QueuedEvent event, Map<String, Object> payload) {
        return new EventContext(event.id(), event.eventType(), event.consumerGroup(), payload,
                event.attempt(), event.maxAttempts(), event.correlationId(), event.sourceService());
    }

    /** Returns {@code true} if a failure now would dead-letter the event. */
    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
