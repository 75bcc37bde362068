/**
 * JDBC event queue stores for H2, MySQL and PostgreSQL, with auto-detection
 * via {@link eventqueue.jdbc.store.JdbcEventQueueStores}.
 */
package eventqueue.jdbc.store;
