package eventqueue.jdbc.store;

import java.util.List;

/**
 * H2 event queue store. Primarily for testing.
 *
 * <p>Uses the default subquery-based two-phase claim from {@link AbstractJdbcEventQueueStore}.
 */
public final class H2EventQueueStore extends AbstractJdbcEventQueueStore {

    public H2EventQueueStore() {
        super();
    }

    public H2EventQueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcEventQueueStore withTableName(String tableName) {
        return new H2EventQueueStore(tableName);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }
}
