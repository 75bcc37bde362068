package eventqueue.spi;

import java.sql.Connection;

/**
 * Abstracts the caller's transaction so {@link eventqueue.producer.EventProducer#emit}
 * can insert its fan-out rows on the caller's connection without depending on a
 * specific transaction manager.
 *
 * <p>Implementations: {@code eventqueue.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code eventqueue.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

    /**
     * Returns {@code true} if a transaction is currently active on this thread.
     */
    boolean isTransactionActive();

    /**
     * Returns the JDBC connection bound to the current transaction.
     *
     * @throws IllegalStateException if no transaction is active
     */
    Connection currentConnection();

}
