package eventqueue.producer;

import com.github.f4b6a3.ulid.UlidCreator;
import eventqueue.EventQueueException;
import eventqueue.model.NewEvent;
import eventqueue.registry.ConsumerRegistry;
import eventqueue.spi.ConnectionProvider;
import eventqueue.spi.EventQueueStore;
import eventqueue.spi.MetricsExporter;
import eventqueue.spi.TxContext;
import eventqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Emits events with write-time fan-out: one {@code pending} row per consumer group
 * registered for the event type, all sharing one correlation id and payload.
 *
 * <p>The rows are written atomically. If a {@link TxContext} is configured and the
 * calling thread has an active transaction, the rows join it and become visible when
 * the caller commits. Otherwise the producer runs its own transaction.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventProducer producer = EventProducer.builder()
 *     .connectionProvider(connProvider)
 *     .store(store)
 *     .registry(PipelineEvents.defaultRegistry())
 *     .build();
 *
 * List<Long> ids = producer.emit("prediction_created",
 *     Map.of("prediction_id", 42, "assets", List.of("TSLA")), "analyzer");
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class EventProducer {
    private static final Logger logger = Logger.getLogger(EventProducer.class.getName());

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final ConnectionProvider connectionProvider;
    private final EventQueueStore store;
    private final ConsumerRegistry registry;
    private final TxContext txContext;
    private final JsonCodec jsonCodec;
    private final MetricsExporter metrics;
    private final Clock clock;

    private EventProducer(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.txContext = builder.txContext;
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConsumerRegistry registry() {
        return registry;
    }

    /**
     * Emits an event with a fresh correlation id and {@value #DEFAULT_MAX_ATTEMPTS} attempts.
     *
     * @see #emit(String, Map, String, String, int)
     */
    public List<Long> emit(String eventType, Map<String, Object> payload, String sourceService) {
        return emit(eventType, payload, sourceService, null, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Emits an event continuing an existing correlation chain.
     *
     * @see #emit(String, Map, String, String, int)
     */
    public List<Long> emit(String eventType, Map<String, Object> payload, String sourceService,
            String correlationId) {
        return emit(eventType, payload, sourceService, correlationId, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Emits an event to every consumer group registered for its type.
     *
     * @param eventType     registered event type
     * @param payload       opaque payload document ({@code null} is stored as an empty object)
     * @param sourceService name of the emitting service
     * @param correlationId correlation id to reuse, or {@code null} to generate one
     * @param maxAttempts   attempts allowed per row before dead-letter, at least 1
     * @return ids of the created rows in insertion order; empty for a terminal type
     * @throws eventqueue.registry.UnknownEventTypeException if the type is not registered
     * @throws IllegalArgumentException if {@code maxAttempts < 1}
     * @throws EventQueueException if the rows cannot be written (none are)
     */
    public List<Long> emit(String eventType, Map<String, Object> payload, String sourceService,
            String correlationId, int maxAttempts) {
        Objects.requireNonNull(eventType, "eventType");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        List<String> consumers = registry.consumersFor(eventType);
        if (consumers.isEmpty()) {
            logger.log(Level.FINE, "Event {0} has no consumers, skipping emission", eventType);
            return List.of();
        }

        String correlation = correlationId != null ? correlationId : newCorrelationId();
        String payloadJson = jsonCodec.toJson(payload);
        List<NewEvent> rows = new ArrayList<>(consumers.size());
        for (String consumerGroup : consumers) {
            rows.add(new NewEvent(eventType, consumerGroup, payloadJson, sourceService, correlation, maxAttempts));
        }

        List<Long> ids = insertAtomically(rows, clock.instant());
        metrics.incrementEmitted(eventType, ids.size());
        logger.log(Level.INFO, "Emitted {0} to {1} consumer(s): {2} (correlationId={3}, source={4})",
                new Object[]{eventType, consumers.size(), String.join(", ", consumers), correlation, sourceService});
        return ids;
    }

    private List<Long> insertAtomically(List<NewEvent> rows, Instant now) {
        if (txContext != null && txContext.isTransactionActive()) {
            return store.insertAll(txContext.currentConnection(), rows, now);
        }
        try (Connection conn = connectionProvider.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                List<Long> ids = store.insertAll(conn, rows, now);
                conn.commit();
                return ids;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new EventQueueException("Failed to emit " + rows.get(0).eventType(), e);
        }
    }

    private static String newCorrelationId() {
        return UlidCreator.getMonotonicUlid().toString();
    }

    /**
     * Builder for {@link EventProducer}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventQueueStore store;
        private ConsumerRegistry registry;
        private TxContext txContext;
        private JsonCodec jsonCodec;
        private MetricsExporter metrics;
        private Clock clock;

        private Builder() {
        }

        /**
         * Sets the connection provider used when no caller transaction is active.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * <b>Required.</b>
         */
        public Builder store(EventQueueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the fan-out registry.
         *
         * <p><b>Required.</b>
         */
        public Builder registry(ConsumerRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the transaction context emits join when a caller transaction is active.
         *
         * <p>Optional. Without it every emit runs in its own transaction.
         */
        public Builder txContext(TxContext txContext) {
            this.txContext = txContext;
            return this;
        }

        /**
         * Optional. Defaults to {@link JsonCodec#getDefault()}.
         */
        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = jsonCodec;
            return this;
        }

        /**
         * Optional. Defaults to {@link MetricsExporter#NOOP}.
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the clock stamping {@code created_at}. Optional. Defaults to UTC system time.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws NullPointerException if a required component is missing
         */
        public EventProducer build() {
            return new EventProducer(this);
        }
    }
}
