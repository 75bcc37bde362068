package eventqueue.model;

/**
 * Filters for listing recent events. {@code null} filters match everything.
 * Results are ordered newest first; a limit of {@code 0} matches nothing.
 */
public record EventQuery(EventStatus status, String eventType, String consumerGroup, int limit) {
    public static final int DEFAULT_LIMIT = 20;

    public EventQuery {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
    }

    public static EventQuery recent() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EventQuery}. */
    public static final class Builder {
        private EventStatus status;
        private String eventType;
        private String consumerGroup;
        private int limit = DEFAULT_LIMIT;

        private Builder() {}

        public Builder status(EventStatus status) {
            this.status = status;
            return this;
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder consumerGroup(String consumerGroup) {
            this.consumerGroup = consumerGroup;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(status, eventType, consumerGroup, limit);
        }
    }
}
