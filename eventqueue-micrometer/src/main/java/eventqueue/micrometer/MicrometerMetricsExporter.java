package eventqueue.micrometer;

import eventqueue.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Meters are registered lazily, one per tag value, so each consumer group
 * (or event type for emits) gets its own time series.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventqueue.emitted} rows written by emits, tagged {@code event_type}</li>
 *   <li>{@code eventqueue.claimed} events claimed, tagged {@code consumer_group}</li>
 *   <li>{@code eventqueue.completed} events completed</li>
 *   <li>{@code eventqueue.retried} failed events scheduled for retry</li>
 *   <li>{@code eventqueue.dead_letter} events moved to dead-letter</li>
 *   <li>{@code eventqueue.claim.failures} claim transactions that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventqueue.batch.last.size} size of the most recent claimed batch</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code eventqueue.processing.duration.ms} consumer execution time</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
    static final String EVENT_TYPE_TAG = "event_type";
    static final String CONSUMER_GROUP_TAG = "consumer_group";

    private final MeterRegistry registry;
    private final String namePrefix;
    private final Map<String, Meter> meters = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> lastBatchSizes = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "eventqueue"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "eventqueue");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "pipeline.queue"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }
        this.registry = registry;
        this.namePrefix = namePrefix;
    }

    @Override
    public void incrementEmitted(String eventType, int rows) {
        if (closed) return;
        counter("emitted", "Rows written by fan-out emits", EVENT_TYPE_TAG, eventType).increment(rows);
    }

    @Override
    public void incrementClaimed(String consumerGroup, int count) {
        if (closed) return;
        counter("claimed", "Events claimed by workers", CONSUMER_GROUP_TAG, consumerGroup).increment(count);
    }

    @Override
    public void incrementCompleted(String consumerGroup) {
        if (closed) return;
        counter("completed", "Events completed successfully", CONSUMER_GROUP_TAG, consumerGroup).increment();
    }

    @Override
    public void incrementRetried(String consumerGroup) {
        if (closed) return;
        counter("retried", "Failed events scheduled for retry", CONSUMER_GROUP_TAG, consumerGroup).increment();
    }

    @Override
    public void incrementDeadLettered(String consumerGroup) {
        if (closed) return;
        counter("dead_letter", "Events moved to dead-letter", CONSUMER_GROUP_TAG, consumerGroup).increment();
    }

    @Override
    public void incrementClaimFailures(String consumerGroup) {
        if (closed) return;
        counter("claim.failures", "Claim transactions that failed", CONSUMER_GROUP_TAG, consumerGroup).increment();
    }

    @Override
    public void recordBatchSize(String consumerGroup, int size) {
        if (closed) return;
        lastBatchSizes.computeIfAbsent(consumerGroup, group -> {
            AtomicInteger holder = new AtomicInteger();
            String name = namePrefix + ".batch.last.size";
            meters.put(key(name, group), Gauge.builder(name, holder, AtomicInteger::get)
                    .description("Size of the most recent claimed batch")
                    .tag(CONSUMER_GROUP_TAG, group)
                    .register(registry));
            return holder;
        }).set(size);
    }

    @Override
    public void recordProcessingDurationMs(String consumerGroup, long durationMs) {
        if (closed) return;
        String name = namePrefix + ".processing.duration.ms";
        DistributionSummary summary = (DistributionSummary) meters.computeIfAbsent(key(name, consumerGroup),
                k -> DistributionSummary.builder(name)
                        .description("Consumer execution time in milliseconds")
                        .tag(CONSUMER_GROUP_TAG, consumerGroup)
                        .register(registry));
        summary.record(durationMs);
    }

    private Counter counter(String suffix, String description, String tag, String value) {
        String name = namePrefix + "." + suffix;
        return (Counter) meters.computeIfAbsent(key(name, value),
                k -> Counter.builder(name)
                        .description(description)
                        .tag(tag, value)
                        .register(registry));
    }

    private static String key(String name, String tagValue) {
        return name + "|" + tagValue;
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        List<Meter> registered = new ArrayList<>(meters.values());
        for (Meter meter : registered) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        meters.clear();
        lastBatchSizes.clear();
        if (first != null) throw first;
    }
}
