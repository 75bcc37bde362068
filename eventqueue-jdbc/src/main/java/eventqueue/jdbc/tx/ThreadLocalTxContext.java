package eventqueue.jdbc.tx;

import eventqueue.spi.TxContext;

import java.sql.Connection;

/**
 * {@link TxContext} implementation that stores the transaction connection in a {@link ThreadLocal}.
 *
 * <p>Designed for manual JDBC transaction management. Use with
 * {@link JdbcTransactionManager} which handles binding and cleanup.
 *
 * @see JdbcTransactionManager
 */
public final class ThreadLocalTxContext implements TxContext {
    private final ThreadLocal<Connection> current = new ThreadLocal<>();

    @Override
    public boolean isTransactionActive() {
        return current.get() != null;
    }

    @Override
    public Connection currentConnection() {
        Connection connection = current.get();
        if (connection == null) {
            throw new IllegalStateException("No active transaction");
        }
        return connection;
    }

    void bind(Connection connection) {
        if (current.get() != null) {
            throw new IllegalStateException("Transaction already active");
        }
        current.set(connection);
    }

    void clear() {
        current.remove();
    }
}
