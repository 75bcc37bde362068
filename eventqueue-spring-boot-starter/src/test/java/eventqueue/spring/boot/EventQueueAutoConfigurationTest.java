package eventqueue.spring.boot;

import eventqueue.EventConsumer;
import eventqueue.jdbc.DataSourceConnectionProvider;
import eventqueue.jdbc.store.AbstractJdbcEventQueueStore;
import eventqueue.jdbc.store.H2EventQueueStore;
import eventqueue.maintenance.CleanupScheduler;
import eventqueue.maintenance.QueueMaintenance;
import eventqueue.model.EventStatus;
import eventqueue.producer.EventProducer;
import eventqueue.registry.ConsumerRegistry;
import eventqueue.registry.PipelineEvents;
import eventqueue.spi.ConnectionProvider;
import eventqueue.spi.TxContext;
import eventqueue.spring.SpringTxContext;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class EventQueueAutoConfigurationTest {

    private ApplicationContextRunner runner() {
        return new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        DataSourceAutoConfiguration.class,
                        SqlInitializationAutoConfiguration.class,
                        EventQueueAutoConfiguration.class))
                .withPropertyValues(
                        "spring.datasource.url=jdbc:h2:mem:eventqueue_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
                        "spring.datasource.driver-class-name=org.h2.Driver",
                        "spring.sql.init.mode=always",
                        "spring.sql.init.schema-locations=classpath:schema/h2.sql",
                        "eventqueue.worker.poll-interval=50ms");
    }

    @Test
    void createsAllBeans() {
        runner().run(ctx -> {
            assertTrue(ctx.containsBean("eventQueueStore"));
            assertTrue(ctx.containsBean("connectionProvider"));
            assertTrue(ctx.containsBean("txContext"));
            assertTrue(ctx.containsBean("consumerRegistry"));
            assertTrue(ctx.containsBean("eventProducer"));
            assertTrue(ctx.containsBean("queueMaintenance"));
            assertTrue(ctx.containsBean("eventWorkerHost"));
            assertFalse(ctx.containsBean("cleanupScheduler"));

            assertInstanceOf(H2EventQueueStore.class, ctx.getBean(AbstractJdbcEventQueueStore.class));
            assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
            assertInstanceOf(SpringTxContext.class, ctx.getBean(TxContext.class));
            assertEquals(PipelineEvents.defaultRegistry().asMap(), ctx.getBean(ConsumerRegistry.class).asMap());
        });
    }

    @Test
    void registryFromProperties() {
        runner()
                .withPropertyValues(
                        "eventqueue.registry.event-types[orders_placed]=billing,shipping",
                        "eventqueue.registry.event-types[orders_archived]=")
                .run(ctx -> {
                    ConsumerRegistry registry = ctx.getBean(ConsumerRegistry.class);
                    assertEquals(List.of("billing", "shipping"), registry.consumersFor("orders_placed"));
                    assertEquals(List.of(), registry.consumersFor("orders_archived"));
                    assertFalse(registry.isRegistered(PipelineEvents.POSTS_HARVESTED));
                });
    }

    @Test
    void customTableName() {
        runner()
                .withPropertyValues("eventqueue.table-name=pipeline_events")
                .run(ctx -> assertEquals("pipeline_events",
                        ctx.getBean(AbstractJdbcEventQueueStore.class).tableName()));
    }

    @Test
    void hostedWorkerProcessesEmittedEvents() {
        runner().withUserConfiguration(ConsumerConfig.class).run(ctx -> {
            EventWorkerHost host = ctx.getBean(EventWorkerHost.class);
            assertTrue(host.isRunning());
            assertEquals(1, host.workers().size());
            assertEquals(PipelineEvents.S3_PROCESSOR, host.workers().get(0).consumerGroup());

            ctx.getBean(EventProducer.class).emit(PipelineEvents.POSTS_HARVESTED, Map.of("posts", 5), "harvester");

            assertTrue(ctx.getBean(LatchConsumer.class).latch.await(5, TimeUnit.SECONDS));
            QueueMaintenance maintenance = ctx.getBean(QueueMaintenance.class);
            long deadline = System.currentTimeMillis() + 5_000;
            while (maintenance.countByStatus(EventStatus.COMPLETED) < 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, maintenance.countByStatus(EventStatus.COMPLETED));
        });
    }

    @Test
    void workersCanBeDisabled() {
        runner()
                .withPropertyValues("eventqueue.worker.enabled=false")
                .withUserConfiguration(ConsumerConfig.class)
                .run(ctx -> assertFalse(ctx.containsBean("eventWorkerHost")));
    }

    @Test
    void cleanupSchedulerWhenEnabled() {
        runner()
                .withPropertyValues("eventqueue.cleanup.enabled=true", "eventqueue.cleanup.interval=5m")
                .run(ctx -> assertThat(ctx).hasSingleBean(CleanupScheduler.class));
    }

    @Test
    void notLoadedWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(EventQueueAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("eventProducer")));
    }

    @Test
    void respectsConditionalOnMissingBean() {
        runner().withUserConfiguration(CustomStoreConfig.class).run(ctx -> {
            assertEquals("my_custom_store", ctx.getBeanNamesForType(AbstractJdbcEventQueueStore.class)[0]);
            assertEquals("custom_events", ctx.getBean(AbstractJdbcEventQueueStore.class).tableName());
        });
    }

    static class LatchConsumer implements EventConsumer {
        final CountDownLatch latch = new CountDownLatch(1);

        @Override
        public String consumerGroup() {
            return PipelineEvents.S3_PROCESSOR;
        }

        @Override
        public Map<String, Object> process(String eventType, Map<String, Object> payload) {
            latch.countDown();
            return Map.of("archived", payload.get("posts"));
        }
    }

    @Configuration
    static class ConsumerConfig {
        @Bean
        LatchConsumer latchConsumer() {
            return new LatchConsumer();
        }
    }

    @Configuration
    static class CustomStoreConfig {
        @Bean("my_custom_store")
        AbstractJdbcEventQueueStore eventQueueStore() {
            return new H2EventQueueStore("custom_events");
        }
    }
}
