/**
 * Service provider interfaces: storage, connections, transactions and metrics.
 */
package eventqueue.spi;
