package eventqueue.spring.boot;

import eventqueue.EventConsumer;
import eventqueue.jdbc.DataSourceConnectionProvider;
import eventqueue.jdbc.store.AbstractJdbcEventQueueStore;
import eventqueue.jdbc.store.JdbcEventQueueStores;
import eventqueue.maintenance.CleanupScheduler;
import eventqueue.maintenance.QueueMaintenance;
import eventqueue.producer.EventProducer;
import eventqueue.registry.ConsumerRegistry;
import eventqueue.registry.PipelineEvents;
import eventqueue.spi.ConnectionProvider;
import eventqueue.spi.EventQueueStore;
import eventqueue.spi.MetricsExporter;
import eventqueue.spi.TxContext;
import eventqueue.spring.SpringTxContext;
import eventqueue.worker.EventWorker;
import eventqueue.worker.ExponentialBackoffRetryPolicy;
import eventqueue.worker.RetryPolicy;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

/**
 * Auto-configuration for the event queue.
 *
 * <p>Wires a store detected from the {@link DataSource}, the consumer registry, the
 * producer, the maintenance facade, and a persistent worker for every
 * {@link EventConsumer} bean. Periodic cleanup is opt-in via {@code eventqueue.cleanup.enabled}.
 *
 * @see EventQueueProperties
 * @see EventQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventProducer.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventQueueProperties.class)
public class EventQueueAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(EventQueueStore.class)
    public AbstractJdbcEventQueueStore eventQueueStore(DataSource dataSource, EventQueueProperties props) {
        return JdbcEventQueueStores.detect(dataSource, props.getTableName());
    }

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
        return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(TxContext.class)
    public SpringTxContext txContext(DataSource dataSource) {
        return new SpringTxContext(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConsumerRegistry consumerRegistry(EventQueueProperties props) {
        Map<String, List<String>> configured = props.getRegistry().getEventTypes();
        if (configured.isEmpty()) {
            return PipelineEvents.defaultRegistry();
        }
        ConsumerRegistry.Builder builder = ConsumerRegistry.builder();
        configured.forEach((eventType, groups) -> builder.register(eventType, groups == null
                ? List.of()
                : groups.stream().filter(group -> !group.isBlank()).toList()));
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventProducer eventProducer(ConnectionProvider connectionProvider,
            EventQueueStore store,
            ConsumerRegistry consumerRegistry,
            TxContext txContext,
            ObjectProvider<MetricsExporter> metricsProvider) {
        return EventProducer.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .registry(consumerRegistry)
                .txContext(txContext)
                .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueMaintenance queueMaintenance(ConnectionProvider connectionProvider, EventQueueStore store) {
        return new QueueMaintenance(connectionProvider, store);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventqueue.worker", name = "enabled", matchIfMissing = true)
    public EventWorkerHost eventWorkerHost(EventQueueProperties props,
            ConnectionProvider connectionProvider,
            EventQueueStore store,
            ObjectProvider<EventConsumer> consumers,
            ObjectProvider<MetricsExporter> metricsProvider) {
        EventQueueProperties.Worker worker = props.getWorker();
        RetryPolicy retryPolicy = new ExponentialBackoffRetryPolicy(
                props.getRetry().getBaseDelay().toMillis(), props.getRetry().getMaxDelay().toMillis());
        MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
        return new EventWorkerHost(consumers.orderedStream().toList(), consumer -> EventWorker.builder()
                .connectionProvider(connectionProvider)
                .store(store)
                .consumer(consumer)
                .pollInterval(worker.getPollInterval())
                .batchSize(worker.getBatchSize())
                .drainTimeout(worker.getDrainTimeout())
                .retryPolicy(retryPolicy)
                .metrics(metrics)
                .build());
    }

    @Bean(initMethod = "start", destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "eventqueue.cleanup", name = "enabled")
    public CleanupScheduler cleanupScheduler(EventQueueProperties props, QueueMaintenance maintenance) {
        EventQueueProperties.Cleanup cleanup = props.getCleanup();
        return CleanupScheduler.builder()
                .maintenance(maintenance)
                .completedRetention(cleanup.getCompletedRetention())
                .deadLetterRetention(cleanup.getDeadLetterRetention())
                .interval(cleanup.getInterval())
                .build();
    }
}
