/**
 * JDBC helpers shared by the event queue stores.
 */
package eventqueue.jdbc;
