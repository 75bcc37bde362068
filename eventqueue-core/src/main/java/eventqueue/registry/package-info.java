/**
 * Fan-out configuration: which consumer groups receive each event type.
 *
 * @see eventqueue.registry.ConsumerRegistry
 */
package eventqueue.registry;
