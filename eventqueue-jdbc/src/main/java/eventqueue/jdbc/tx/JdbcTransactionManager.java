package eventqueue.jdbc.tx;

import eventqueue.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection,
 * disables auto-commit, and binds it to a {@link ThreadLocalTxContext} so an
 * {@link eventqueue.producer.EventProducer} built with the same context joins it.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     insertPrediction(txContext.currentConnection(), prediction);
 *     producer.emit("prediction_created", payload, "analyzer");
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager {
    private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

    private final ConnectionProvider connectionProvider;
    private final ThreadLocalTxContext txContext;

    public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.txContext = Objects.requireNonNull(txContext, "txContext");
    }

    /**
     * Begins a new transaction by obtaining a connection and binding it to the thread context.
     *
     * @return a new {@link Transaction} handle (use with try-with-resources)
     * @throws SQLException if a connection cannot be obtained
     */
    public Transaction begin() throws SQLException {
        Connection connection = connectionProvider.getConnection();
        try {
            connection.setAutoCommit(false);
            txContext.bind(connection);
        } catch (SQLException | RuntimeException e) {
            connection.close();
            throw e;
        }
        return new Transaction(connection, txContext);
    }

    /**
     * An active transaction handle. If neither {@link #commit()} nor {@link #rollback()}
     * is called, {@link #close()} rolls back.
     */
    public static final class Transaction implements AutoCloseable {
        private final Connection connection;
        private final ThreadLocalTxContext txContext;
        private boolean completed;

        private Transaction(Connection connection, ThreadLocalTxContext txContext) {
            this.connection = connection;
            this.txContext = txContext;
        }

        public void commit() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.commit();
            } catch (SQLException e) {
                rollbackAfterFailedCommit(e);
                throw e;
            } finally {
                finalizeTx();
            }
        }

        public void rollback() throws SQLException {
            if (completed) {
                return;
            }
            try {
                connection.rollback();
            } finally {
                finalizeTx();
            }
        }

        @Override
        public void close() throws SQLException {
            if (!completed) {
                rollback();
            }
        }

        private void rollbackAfterFailedCommit(SQLException commitFailure) {
            try {
                connection.rollback();
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
                commitFailure.addSuppressed(e);
            }
        }

        private void finalizeTx() throws SQLException {
            completed = true;
            txContext.clear();
            try {
                connection.setAutoCommit(true);
            } finally {
                connection.close();
            }
        }
    }
}
