package eventqueue.spi;

/**
 * Observability hook for exporting queue counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records rows written by one fan-out emit.
     *
     * @param eventType the emitted event type
     * @param rows      number of rows written (one per consumer group)
     */
    void incrementEmitted(String eventType, int rows);

    /**
     * Records events claimed by one poll.
     */
    void incrementClaimed(String consumerGroup, int count);

    /**
     * Increments the count of events completed successfully.
     */
    void incrementCompleted(String consumerGroup);

    /**
     * Increments the count of failed events scheduled for another attempt.
     */
    void incrementRetried(String consumerGroup);

    /**
     * Increments the count of events moved to dead-letter.
     */
    void incrementDeadLettered(String consumerGroup);

    /**
     * Increments the count of claim transactions that failed (infrastructure errors).
     */
    void incrementClaimFailures(String consumerGroup);

    /**
     * Records the size of the most recent claimed batch.
     */
    default void recordBatchSize(String consumerGroup, int size) {
    }

    /**
     * Records the time spent inside the consumer for one event.
     *
     * @param durationMs consumer execution time in milliseconds (always non-negative)
     */
    default void recordProcessingDurationMs(String consumerGroup, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEmitted(String eventType, int rows) {
        }

        @Override
        public void incrementClaimed(String consumerGroup, int count) {
        }

        @Override
        public void incrementCompleted(String consumerGroup) {
        }

        @Override
        public void incrementRetried(String consumerGroup) {
        }

        @Override
        public void incrementDeadLettered(String consumerGroup) {
        }

        @Override
        public void incrementClaimFailures(String consumerGroup) {
        }
    }
}
