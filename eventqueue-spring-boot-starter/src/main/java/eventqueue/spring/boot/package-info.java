/**
 * Spring Boot auto-configuration for the event queue.
 *
 * <p>Add the starter, a {@code DataSource}, and {@link eventqueue.EventConsumer} beans;
 * inject {@link eventqueue.producer.EventProducer} to emit.
 */
package eventqueue.spring.boot;
