package eventqueue.jdbc.store;

import eventqueue.jdbc.JdbcTemplate;
import eventqueue.model.QueuedEvent;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * MySQL event queue store. Also compatible with TiDB.
 *
 * <p>Locks candidate rows with {@code SELECT ... FOR UPDATE SKIP LOCKED} (MySQL 8.0+),
 * flips them to claimed with an {@code UPDATE} by id, then re-reads them. The three
 * statements must share the caller's transaction for the row locks to hold; on an
 * auto-commit connection the {@code status='pending'} guard on the update still
 * prevents a double claim.
 */
public final class MySqlEventQueueStore extends AbstractJdbcEventQueueStore {

    public MySqlEventQueueStore() {
        super();
    }

    public MySqlEventQueueStore(String tableName) {
        super(tableName);
    }

    @Override
    public AbstractJdbcEventQueueStore withTableName(String tableName) {
        return new MySqlEventQueueStore(tableName);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    public List<QueuedEvent> claimPending(Connection conn, String consumerGroup, String workerId,
            Instant now, int limit) {
        Objects.requireNonNull(workerId, "workerId");
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        String lockSql = "SELECT id FROM " + tableName() + " WHERE " + claimableCondition() +
                " ORDER BY id LIMIT ? FOR UPDATE SKIP LOCKED";
        List<Long> ids = JdbcTemplate.query(conn, lockSql, rs -> rs.getLong("id"),
                consumerGroup, Timestamp.from(now), limit);
        if (ids.isEmpty()) {
            return List.of();
        }
        String claimSql = "UPDATE " + tableName() + " SET " + claimAssignments() +
                " WHERE id IN (" + JdbcTemplate.placeholders(ids.size()) + ") AND status=" + PENDING;
        List<Object> params = new ArrayList<>();
        params.add(workerId);
        params.add(Timestamp.from(nowMs));
        params.add(Timestamp.from(nowMs));
        params.addAll(ids);
        int updated = JdbcTemplate.update(conn, claimSql, params.toArray());
        if (updated == 0) {
            return List.of();
        }
        return selectClaimed(conn, workerId, nowMs);
    }
}
