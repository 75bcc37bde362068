package eventqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for queue operations that manage their own transactions
 * (claiming, finalizing, maintenance, and emits outside a caller transaction).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see eventqueue.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
