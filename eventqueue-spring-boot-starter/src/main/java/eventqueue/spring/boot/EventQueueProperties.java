package eventqueue.spring.boot;

import eventqueue.jdbc.TableNames;
import eventqueue.maintenance.CleanupScheduler;
import eventqueue.worker.ExponentialBackoffRetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the event queue.
 *
 * <pre>
 * eventqueue.table-name=events
 * eventqueue.registry.event-types[posts_harvested]=s3_processor
 * eventqueue.registry.event-types[prediction_created]=market_data,notifications
 * eventqueue.registry.event-types[prices_backfilled]=
 * eventqueue.worker.batch-size=10
 * eventqueue.cleanup.enabled=true
 * </pre>
 *
 * @see EventQueueAutoConfiguration
 */
@ConfigurationProperties(prefix = "eventqueue")
public class EventQueueProperties {

    /**
     * Database table name for queued events.
     */
    private String tableName = TableNames.DEFAULT_TABLE;

    private final Registry registry = new Registry();
    private final Worker worker = new Worker();
    private final Retry retry = new Retry();
    private final Cleanup cleanup = new Cleanup();
    private final Metrics metrics = new Metrics();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public Registry getRegistry() {
        return registry;
    }

    public Worker getWorker() {
        return worker;
    }

    public Retry getRetry() {
        return retry;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Registry {
        /**
         * Event type to consumer groups. An empty list marks a terminal type.
         * When no entry is configured the default pipeline registry is used.
         */
        private Map<String, List<String>> eventTypes = new LinkedHashMap<>();

        public Map<String, List<String>> getEventTypes() {
            return eventTypes;
        }

        public void setEventTypes(Map<String, List<String>> eventTypes) {
            this.eventTypes = eventTypes;
        }
    }

    public static class Worker {
        /**
         * Whether to host a persistent worker for every EventConsumer bean.
         */
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofSeconds(2);
        private int batchSize = 10;
        private Duration drainTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofMillis(ExponentialBackoffRetryPolicy.DEFAULT_BASE_DELAY_MS);
        private Duration maxDelay = Duration.ofMillis(ExponentialBackoffRetryPolicy.DEFAULT_MAX_DELAY_MS);

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }
    }

    public static class Cleanup {
        /**
         * Whether to run the periodic cleanup of old terminal events.
         */
        private boolean enabled = false;
        private Duration completedRetention = CleanupScheduler.DEFAULT_COMPLETED_RETENTION;
        private Duration deadLetterRetention = CleanupScheduler.DEFAULT_DEAD_LETTER_RETENTION;
        private Duration interval = CleanupScheduler.DEFAULT_INTERVAL;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCompletedRetention() {
            return completedRetention;
        }

        public void setCompletedRetention(Duration completedRetention) {
            this.completedRetention = completedRetention;
        }

        public Duration getDeadLetterRetention() {
            return deadLetterRetention;
        }

        public void setDeadLetterRetention(Duration deadLetterRetention) {
            this.deadLetterRetention = deadLetterRetention;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "eventqueue";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
