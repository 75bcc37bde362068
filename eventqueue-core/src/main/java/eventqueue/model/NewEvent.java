package eventqueue.model;

import java.util.Objects;

/**
 * A single row to insert with status {@code pending}. The producer builds one
 * per consumer group when fanning out an occurrence.
 */
public record NewEvent(
        String eventType,
        String consumerGroup,
        String payloadJson,
        String sourceService,
        String correlationId,
        int maxAttempts
) {

    public NewEvent {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(consumerGroup, "consumerGroup");
        Objects.requireNonNull(payloadJson, "payloadJson");
        Objects.requireNonNull(correlationId, "correlationId");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }
}
