package eventqueue.jdbc.store;

import eventqueue.jdbc.JdbcTemplate;
import eventqueue.model.QueuedEvent;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * PostgreSQL event queue store.
 *
 * <p>Uses {@code FOR UPDATE SKIP LOCKED} with {@code RETURNING} for
 * single-round-trip claim. Payload and result columns are {@code JSONB}.
 */
public final class PostgresEventQueueStore extends AbstractJdbcEventQueueStore {

    public PostgresEventQueueStore() {
        super();
    }

    public PostgresEventQueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcEventQueueStore withTableName(String tableName) {
        return new PostgresEventQueueStore(tableName);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected String jsonParameter() {
        return "CAST(? AS JSONB)";
    }

    @Override
    public List<QueuedEvent> claimPending(Connection conn, String consumerGroup, String workerId,
            Instant now, int limit) {
        Objects.requireNonNull(workerId, "workerId");
        String sql = "UPDATE " + tableName() + " SET " + claimAssignments() +
                " WHERE id IN (" +
                "SELECT id FROM " + tableName() + " WHERE " + claimableCondition() +
                " ORDER BY id LIMIT ?" +
                " FOR UPDATE SKIP LOCKED" +
                ") RETURNING " + COLUMNS;
        Timestamp ts = Timestamp.from(now);
        List<QueuedEvent> claimed = new ArrayList<>(JdbcTemplate.updateReturning(conn, sql, EVENT_ROW_MAPPER,
                workerId, ts, ts, consumerGroup, ts, limit));
        // RETURNING order is unspecified
        claimed.sort(Comparator.comparingLong(QueuedEvent::id));
        return claimed;
    }
}
