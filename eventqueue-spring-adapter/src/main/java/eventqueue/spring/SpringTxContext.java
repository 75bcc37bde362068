package eventqueue.spring;

import eventqueue.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>Connections are obtained through {@link DataSourceUtils} so an emit inside a
 * {@code @Transactional} method writes its rows on the caller's connection and commits
 * or rolls back with the caller's work.
 *
 * <p>Requires Spring's transaction synchronization to be active (the default).
 * Environments configured with {@code SYNCHRONIZATION_NEVER} get an
 * {@link IllegalStateException} from {@link #currentConnection()}.
 */
public final class SpringTxContext implements TxContext {
    private final DataSource dataSource;

    public SpringTxContext(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public boolean isTransactionActive() {
        return TransactionSynchronizationManager.isActualTransactionActive();
    }

    @Override
    public Connection currentConnection() {
        if (!isTransactionActive()) {
            throw new IllegalStateException("No active transaction");
        }
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            throw new IllegalStateException(
                    "Transaction synchronization is not active; cannot obtain connection safely");
        }
        return DataSourceUtils.getConnection(dataSource);
    }
}
