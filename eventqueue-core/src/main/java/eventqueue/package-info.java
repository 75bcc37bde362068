/**
 * Root API of the event queue: a durable, JDBC-backed job queue with write-time fan-out,
 * atomic claiming, exponential-backoff retry and dead-lettering.
 *
 * <h2>Core Design</h2>
 * <p>An {@linkplain eventqueue.producer.EventProducer producer} writes one {@code pending}
 * row per consumer group registered for the event type in a
 * {@linkplain eventqueue.registry.ConsumerRegistry registry}. Each consumer group is polled
 * by its own {@linkplain eventqueue.worker.EventWorker workers}, which claim due rows in a
 * single transaction and hand them to an {@link eventqueue.EventConsumer}. Delivery is
 * at-least-once per consumer group; consumers must be idempotent.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>eventqueue-core</b>: model, producer, worker, maintenance, SPIs</li>
 *   <li><b>eventqueue-jdbc</b>: JDBC stores (H2, MySQL, PostgreSQL) and manual transactions</li>
 *   <li><b>eventqueue-spring-adapter</b>: Spring transaction integration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var store        = JdbcEventQueueStores.detect(dataSource);
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * var producer = EventProducer.builder()
 *     .connectionProvider(connProvider)
 *     .store(store)
 *     .registry(PipelineEvents.defaultRegistry())
 *     .build();
 * producer.emit("signals_stored", Map.of("signal_ids", List.of("s1")), "harvester");
 *
 * EventWorker worker = EventWorker.builder()
 *     .connectionProvider(connProvider)
 *     .store(store)
 *     .consumer(new AnalyzerConsumer())
 *     .build();
 * worker.drain();   // cron style
 * worker.run();     // or poll until SIGTERM
 * }</pre>
 */
package eventqueue;
