package eventqueue.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable fan-out map from event type to the ordered list of consumer groups that
 * receive a copy of each emitted event.
 *
 * <p>An event type mapped to an empty list is a valid terminal type: emitting it writes
 * nothing. Built once at start-up and handed to the producer explicitly.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ConsumerRegistry registry = ConsumerRegistry.builder()
 *     .register("prediction_created", "market_data", "notifications")
 *     .terminal("prices_backfilled")
 *     .build();
 * }</pre>
 *
 * @see PipelineEvents#defaultRegistry()
 */
public final class ConsumerRegistry {
    private final Map<String, List<String>> groupsByType;

    private ConsumerRegistry(Map<String, List<String>> groupsByType) {
        this.groupsByType = Collections.unmodifiableMap(new LinkedHashMap<>(groupsByType));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the consumer groups registered for an event type, in registration order.
     *
     * @param eventType the event type
     * @return the consumer groups (empty for terminal types)
     * @throws UnknownEventTypeException if the type is not registered
     */
    public List<String> consumersFor(String eventType) {
        List<String> groups = groupsByType.get(eventType);
        if (groups == null) {
            throw new UnknownEventTypeException(eventType, groupsByType.keySet());
        }
        return groups;
    }

    public boolean isRegistered(String eventType) {
        return groupsByType.containsKey(eventType);
    }

    public Set<String> eventTypes() {
        return groupsByType.keySet();
    }

    /** Read-only view of the full mapping. */
    public Map<String, List<String>> asMap() {
        return groupsByType;
    }

    @Override
    public String toString() {
        return "ConsumerRegistry" + groupsByType;
    }

    /** Builder for {@link ConsumerRegistry}. */
    public static final class Builder {
        private final Map<String, List<String>> groupsByType = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Maps an event type to its consumer groups. Re-registering a type replaces its groups.
         *
         * @param eventType      non-blank event type
         * @param consumerGroups non-blank, distinct consumer groups (none for a terminal type)
         * @return this builder
         */
        public Builder register(String eventType, String... consumerGroups) {
            return register(eventType, List.of(consumerGroups));
        }

        public Builder register(String eventType, List<String> consumerGroups) {
            requireNonBlank(eventType, "eventType");
            Objects.requireNonNull(consumerGroups, "consumerGroups");
            for (String group : consumerGroups) {
                requireNonBlank(group, "consumerGroup");
            }
            if (Set.copyOf(consumerGroups).size() != consumerGroups.size()) {
                throw new IllegalArgumentException("Duplicate consumer group for " + eventType + ": " + consumerGroups);
            }
            groupsByType.put(eventType, List.copyOf(consumerGroups));
            return this;
        }

        /** Registers an event type with no consumers. */
        public Builder terminal(String eventType) {
            return register(eventType, List.of());
        }

        public ConsumerRegistry build() {
            return new ConsumerRegistry(groupsByType);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
        }
    }
}
