package eventqueue.worker;

import eventqueue.EventConsumer;
import eventqueue.EventContext;
import eventqueue.model.EventStatus;
import eventqueue.model.QueuedEvent;
import eventqueue.spi.ConnectionProvider;
import eventqueue.spi.EventQueueStore;
import eventqueue.spi.MetricsExporter;
import eventqueue.util.DaemonThreadFactory;
import eventqueue.util.JsonCodec;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Claim-and-process loop for one consumer group.
 *
 * <p>Each poll atomically claims up to {@code batchSize} due {@code pending} rows in one
 * transaction and commits the claim before any consumer runs. Every claimed row is then
 * re-read, handed to the {@link EventConsumer} and finalized in its own statement: completed
 * on success, back to {@code pending} with backoff or dead-lettered on failure.
 *
 * <p>Operates in three modes:
 * <ul>
 *   <li><b>Drain</b>: {@link #drain()} polls until a poll claims nothing and returns the total.
 *   <li><b>Persistent, foreground</b>: {@link #run()} loops on the calling thread until the JVM
 *       shuts down or {@link #requestShutdown()} is called.
 *   <li><b>Persistent, embedded</b>: {@link #start()} runs the same loop on a daemon thread;
 *       {@link #close()} stops it.
 * </ul>
 *
 * <p>Anything a consumer throws, {@link Error}s included, fails only its own row; the
 * rest of the batch is still processed.
 *
 * <p>Shutdown is cooperative. The flag is checked between batches, so a running batch
 * always finishes; only the idle wait after an empty poll is cut short.
 *
 * <p>Create instances via {@link #builder()}. Several workers, in one or many processes,
 * may poll the same consumer group: the claim never hands a row to two of them.
 *
 * @see EventWorker.Builder
 * @see EventConsumer
 */
public final class EventWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventWorker.class.getName());

    private final ConnectionProvider connectionProvider;
    private final EventQueueStore store;
    private final EventConsumer consumer;
    private final String consumerGroup;
    private final String workerId;
    private final Duration pollInterval;
    private final int batchSize;
    private final RetryPolicy retryPolicy;
    private final JsonCodec jsonCodec;
    private final MetricsExporter metrics;
    private final Clock clock;
    private final Duration drainTimeout;

    private final Object idleMonitor = new Object();
    private volatile boolean shutdownRequested;
    private volatile CountDownLatch loopExited;
    private Thread loopThread;
    private boolean closed;

    private EventWorker(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.consumer = Objects.requireNonNull(builder.consumer, "consumer");

        String group = consumer.consumerGroup();
        if (group == null || group.isBlank()) {
            throw new IllegalArgumentException("consumer_group must be set on " + consumer.getClass().getName());
        }
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.pollInterval == null || builder.pollInterval.isNegative() || builder.pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (builder.drainTimeout == null || builder.drainTimeout.isNegative()) {
            throw new IllegalArgumentException("drainTimeout must be >= 0");
        }

        this.consumerGroup = group;
        this.workerId = builder.workerId != null && !builder.workerId.isBlank()
                ? builder.workerId
                : group + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        this.pollInterval = builder.pollInterval;
        this.batchSize = builder.batchSize;
        this.retryPolicy = builder.retryPolicy != null ? builder.retryPolicy : ExponentialBackoffRetryPolicy.standard();
        this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.drainTimeout = builder.drainTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String workerId() {
        return workerId;
    }

    public String consumerGroup() {
        return consumerGroup;
    }

    /**
     * Claims and processes one batch.
     *
     * <p>A claim failure (storage unavailable, SQL error) is logged and reported as
     * zero processed; nothing is partially claimed. Consumer failures never escape.
     *
     * @return the number of rows claimed, whatever their outcome
     */
    public int pollOnce() {
        List<QueuedEvent> claimed = claimBatch(clock.instant());
        if (claimed.isEmpty()) {
            return 0;
        }
        metrics.incrementClaimed(consumerGroup, claimed.size());
        metrics.recordBatchSize(consumerGroup, claimed.size());
        logger.log(Level.FINE, "Worker {0} claimed {1} event(s)", new Object[]{workerId, claimed.size()});

        for (QueuedEvent event : claimed) {
            processClaimed(event);
        }
        return claimed.size();
    }

    /**
     * Polls until a poll claims nothing.
     *
     * @return total number of rows processed; partial if a claim failed midway
     */
    public int drain() {
        logger.log(Level.INFO, "Worker {0} draining queue (group={1})", new Object[]{workerId, consumerGroup});
        int total = 0;
        int processed;
        do {
            processed = pollOnce();
            total += processed;
        } while (processed > 0);
        logger.log(Level.INFO, "Worker {0} drained {1} events", new Object[]{workerId, total});
        return total;
    }

    /**
     * Runs the persistent loop on the calling thread until shutdown is requested.
     *
     * <p>Registers a JVM shutdown hook so SIGTERM/SIGINT request shutdown and wait up to
     * the drain timeout for the current batch to finish.
     */
    public void run() {
        Thread hook = new Thread(this::shutdownAndAwait, "eventqueue-shutdown-" + workerId);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            loop();
        } finally {
            removeShutdownHook(hook);
        }
    }

    /**
     * Starts the persistent loop on a daemon thread. Subsequent calls are no-ops if already started.
     *
     * @throws IllegalStateException if the worker has been closed
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EventWorker has been closed");
        }
        if (loopThread != null) {
            return;
        }
        loopThread = new DaemonThreadFactory("eventqueue-worker-" + consumerGroup + "-").newThread(this::loop);
        loopThread.start();
    }

    /**
     * Asks the loop to stop after the current batch. Wakes an idle wait immediately.
     */
    public void requestShutdown() {
        shutdownRequested = true;
        synchronized (idleMonitor) {
            idleMonitor.notifyAll();
        }
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Requests shutdown and waits up to the drain timeout for the loop thread to finish its batch.
     */
    @Override
    public synchronized void close() {
        closed = true;
        requestShutdown();
        if (loopThread != null) {
            try {
                loopThread.join(drainTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (loopThread.isAlive()) {
                logger.log(Level.WARNING, "Worker {0} did not stop within {1}", new Object[]{workerId, drainTimeout});
            }
            loopThread = null;
        }
    }

    private void loop() {
        CountDownLatch exited = new CountDownLatch(1);
        loopExited = exited;
        logger.log(Level.INFO, "Worker {0} starting persistent loop (group={1}, interval={2})",
                new Object[]{workerId, consumerGroup, pollInterval});
        try {
            while (!shutdownRequested) {
                int processed;
                try {
                    processed = pollOnce();
                } catch (Throwable t) {
                    logger.log(Level.SEVERE, "Unexpected error in poll loop of worker " + workerId, t);
                    processed = 0;
                }
                if (processed == 0) {
                    idleWait();
                }
            }
            logger.log(Level.INFO, "Worker {0} shut down gracefully", workerId);
        } finally {
            exited.countDown();
        }
    }

    private void idleWait() {
        synchronized (idleMonitor) {
            if (shutdownRequested) {
                return;
            }
            try {
                idleMonitor.wait(pollInterval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                shutdownRequested = true;
            }
        }
    }

    private void shutdownAndAwait() {
        logger.log(Level.INFO, "Worker {0} received shutdown signal", workerId);
        requestShutdown();
        CountDownLatch exited = loopExited;
        if (exited == null) {
            return;
        }
        try {
            if (!exited.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.log(Level.WARNING, "Worker {0} did not stop within {1}", new Object[]{workerId, drainTimeout});
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.log(Level.FINE, "JVM already shutting down, hook for worker {0} stays registered", workerId);
        }
    }

    private List<QueuedEvent> claimBatch(Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                List<QueuedEvent> claimed = store.claimPending(conn, consumerGroup, workerId, now, batchSize);
                conn.commit();
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException | RuntimeException e) {
            metrics.incrementClaimFailures(consumerGroup);
            logger.log(Level.SEVERE, "Failed to claim events for group " + consumerGroup, e);
            return List.of();
        }
    }

    private void processClaimed(QueuedEvent claimed) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            Optional<QueuedEvent> fresh = store.findById(conn, claimed.id());
            if (fresh.isEmpty() || fresh.get().status() != EventStatus.CLAIMED) {
                logger.log(Level.FINE, "Event {0} is no longer claimed, skipping", claimed.id());
                return;
            }
            QueuedEvent event = fresh.get();

            long startNanos = System.nanoTime();
            String resultJson;
            try {
                Map<String, Object> payload = jsonCodec.parseObject(event.payloadJson());
                Map<String, Object> result = consumer.process(EventContext.of(event, payload));
                resultJson = result == null ? null : jsonCodec.toJson(result);
            } catch (Throwable t) {
                recordDuration(startNanos);
                onFailure(conn, event, t);
                return;
            }
            recordDuration(startNanos);
            onSuccess(conn, event, resultJson);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.SEVERE, "Transaction failed for event " + claimed.id(), e);
        }
    }

    private void onSuccess(Connection conn, QueuedEvent event, String resultJson) {
        if (store.markCompleted(conn, event.id(), resultJson, clock.instant()) == 0) {
            logger.log(Level.FINE, "Event {0} changed while processing, completion not recorded", event.id());
            return;
        }
        metrics.incrementCompleted(consumerGroup);
        logger.log(Level.FINE, "Completed event {0} ({1}, attempt {2})",
                new Object[]{event.id(), event.eventType(), event.attempt()});
    }

    private void onFailure(Connection conn, QueuedEvent event, Throwable failure) {
        // Millisecond precision, as stored, so next_retry_at is due at exactly the computed instant
        Instant failedAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        String error = describe(failure);
        EventTransitions.FailureOutcome outcome = EventTransitions.onFailure(event, failedAt, retryPolicy);

        if (outcome instanceof EventTransitions.Retry retry) {
            if (store.markRetry(conn, event.id(), error, retry.nextRetryAt(), failedAt) == 0) {
                logger.log(Level.FINE, "Event {0} changed while processing, retry not recorded", event.id());
                return;
            }
            metrics.incrementRetried(consumerGroup);
            logger.log(Level.WARNING, "Event {0} failed (attempt {1}/{2}), retry at {3}: {4}",
                    new Object[]{event.id(), event.attempt(), event.maxAttempts(), retry.nextRetryAt(), error});
        } else {
            if (store.markDeadLetter(conn, event.id(), error, failedAt) == 0) {
                logger.log(Level.FINE, "Event {0} changed while processing, dead-letter not recorded", event.id());
                return;
            }
            metrics.incrementDeadLettered(consumerGroup);
            logger.log(Level.WARNING, "Event {0} failed (attempt {1}/{2}), moved to dead letter: {3}",
                    new Object[]{event.id(), event.attempt(), event.maxAttempts(), error});
        }
    }

    private void recordDuration(long startNanos) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        metrics.recordProcessingDurationMs(consumerGroup, Math.max(0L, elapsedMs));
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message != null ? message : failure.getClass().getName();
    }

    /**
     * Builder for {@link EventWorker}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private EventQueueStore store;
        private EventConsumer consumer;
        private String workerId;
        private Duration pollInterval = Duration.ofSeconds(2);
        private int batchSize = 10;
        private RetryPolicy retryPolicy;
        private JsonCodec jsonCodec;
        private MetricsExporter metrics;
        private Clock clock;
        private Duration drainTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Sets the connection provider for claim and finalize connections.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets the store used to claim and finalize events.
         *
         * <p><b>Required.</b>
         *
         * @param store the persistence backend
         * @return this builder
         */
        public Builder store(EventQueueStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the consumer; its {@link EventConsumer#consumerGroup()} selects the queue polled.
         *
         * <p><b>Required.</b>
         *
         * @param consumer the business logic
         * @return this builder
         */
        public Builder consumer(EventConsumer consumer) {
            this.consumer = consumer;
            return this;
        }

        /**
         * Sets this instance's identity, written to {@code claimed_by}.
         *
         * <p>Optional. Defaults to {@code <consumer_group>-<8 hex chars>}.
         *
         * @param workerId unique id of this worker instance
         * @return this builder
         */
        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        /**
         * Sets the wait after a poll that claimed nothing (persistent mode only).
         *
         * <p>Optional. Defaults to {@code 2s}. Must be positive.
         *
         * @param pollInterval idle wait between empty polls
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Sets the maximum number of events claimed per poll.
         *
         * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
         *
         * @param batchSize max events per poll
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Optional. Defaults to {@link ExponentialBackoffRetryPolicy#standard()}.
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
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
         * Sets the clock used for claim timestamps and due checks.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets how long {@link EventWorker#close()} and the JVM shutdown hook wait for the
         * current batch.
         *
         * <p>Optional. Defaults to {@code 30s}.
         */
        public Builder drainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
            return this;
        }

        /**
         * Builds the worker. Call {@link EventWorker#drain()}, {@link EventWorker#run()} or
         * {@link EventWorker#start()} to process events.
         *
         * @return a new {@link EventWorker}
         * @throws NullPointerException if a required component is null
         * @throws IllegalArgumentException if the consumer group is blank or a setting is out of range
         */
        public EventWorker build() {
            return new EventWorker(this);
        }
    }
}
