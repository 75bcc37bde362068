package eventqueue.maintenance;

import eventqueue.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically prunes completed and dead-letter events older than their retention.
 *
 * <p>Builder pattern, {@link AutoCloseable}, daemon thread, synchronized lifecycle.
 * A failed cycle is logged and the next one runs on schedule.
 *
 * @see QueueMaintenance#pruneCompleted
 * @see QueueMaintenance#pruneDeadLetter
 */
public final class CleanupScheduler implements AutoCloseable {
    public static final Duration DEFAULT_COMPLETED_RETENTION = Duration.ofDays(7);
    public static final Duration DEFAULT_DEAD_LETTER_RETENTION = Duration.ofDays(30);
    public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);

    private static final Logger logger = Logger.getLogger(CleanupScheduler.class.getName());

    private final QueueMaintenance maintenance;
    private final Duration completedRetention;
    private final Duration deadLetterRetention;
    private final Duration interval;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> cleanupTask;
    private volatile boolean closed;

    private CleanupScheduler(Builder builder) {
        this.maintenance = Objects.requireNonNull(builder.maintenance, "maintenance");
        requireNonNegative(builder.completedRetention, "completedRetention");
        requireNonNegative(builder.deadLetterRetention, "deadLetterRetention");
        if (builder.interval.isNegative() || builder.interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        this.completedRetention = builder.completedRetention;
        this.deadLetterRetention = builder.deadLetterRetention;
        this.interval = builder.interval;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled cleanup loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("CleanupScheduler has been closed");
        }
        if (cleanupTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventqueue-cleanup-"));
        cleanupTask = scheduler.scheduleWithFixedDelay(
                this::runOnce, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single cleanup cycle. May be invoked directly for testing or one-off cleanups.
     */
    public void runOnce() {
        if (closed) {
            return;
        }
        try {
            int completed = maintenance.pruneCompleted(completedRetention);
            int dead = maintenance.pruneDeadLetter(deadLetterRetention);
            if (completed + dead > 0) {
                logger.log(Level.INFO, "Cleanup removed {0} completed and {1} dead-letter events",
                        new Object[]{completed, dead});
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Cleanup cycle failed", t);
        }
    }

    /** Cancels the cleanup schedule and shuts down the scheduler thread. */
    @Override
    public synchronized void close() {
        closed = true;
        if (cleanupTask != null) {
            cleanupTask.cancel(false);
            cleanupTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
    }

    /** Builder for {@link CleanupScheduler}. */
    public static final class Builder {
        private QueueMaintenance maintenance;
        private Duration completedRetention = DEFAULT_COMPLETED_RETENTION;
        private Duration deadLetterRetention = DEFAULT_DEAD_LETTER_RETENTION;
        private Duration interval = DEFAULT_INTERVAL;

        private Builder() {}

        /**
         * <b>Required.</b>
         */
        public Builder maintenance(QueueMaintenance maintenance) {
            this.maintenance = maintenance;
            return this;
        }

        /**
         * Sets how long completed events are kept. Optional. Defaults to {@code 7 days}.
         */
        public Builder completedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
            return this;
        }

        /**
         * Sets how long dead-letter events are kept. Optional. Defaults to {@code 30 days}.
         */
        public Builder deadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
            return this;
        }

        /**
         * Sets the delay between cleanup cycles. Optional. Defaults to {@code 1 hour}.
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public CleanupScheduler build() {
            return new CleanupScheduler(this);
        }
    }
}
