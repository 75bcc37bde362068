package eventqueue.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC event queue stores with auto-detection support.
 *
 * <p>Stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventqueue.jdbc.store.AbstractJdbcEventQueueStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcEventQueueStore store = JdbcEventQueueStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL, custom table
 * AbstractJdbcEventQueueStore store = JdbcEventQueueStores.detect("jdbc:mysql://localhost/mydb", "pipeline_events");
 *
 * // Get by name
 * AbstractJdbcEventQueueStore store = JdbcEventQueueStores.get("postgresql");
 * }</pre>
 */
public final class JdbcEventQueueStores {

    private static final List<AbstractJdbcEventQueueStore> STORES;
    private static final Map<String, AbstractJdbcEventQueueStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcEventQueueStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcEventQueueStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(), store);
        }
    }

    private JdbcEventQueueStores() {
    }

    /**
     * Returns all registered stores.
     */
    public static List<AbstractJdbcEventQueueStore> all() {
        return STORES;
    }

    /**
     * Gets a store by name.
     *
     * @param name store name (case-insensitive)
     * @return the store
     * @throws IllegalArgumentException if no store found
     */
    public static AbstractJdbcEventQueueStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcEventQueueStore store = BY_NAME.get(name.toLowerCase());
        if (store == null) {
            throw new IllegalArgumentException("Unknown event queue store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the store from a DataSource.
     *
     * @throws IllegalStateException if detection fails or no matching store
     */
    public static AbstractJdbcEventQueueStore detect(DataSource dataSource) {
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect event queue store from DataSource", e);
        }
    }

    /**
     * Auto-detects the store from a DataSource, bound to a custom table.
     */
    public static AbstractJdbcEventQueueStore detect(DataSource dataSource, String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        return detect(dataSource).withTableName(tableName);
    }

    /**
     * Auto-detects the store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no matching store found
     */
    public static AbstractJdbcEventQueueStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        for (AbstractJdbcEventQueueStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (jdbcUrl.toLowerCase().startsWith(prefix.toLowerCase())) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No event queue store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    public static AbstractJdbcEventQueueStore detect(String jdbcUrl, String tableName) {
        Objects.requireNonNull(tableName, "tableName");
        return detect(jdbcUrl).withTableName(tableName);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
