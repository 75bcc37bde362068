package eventqueue.jdbc.store;

import eventqueue.jdbc.JdbcTemplate;
import eventqueue.jdbc.TableNames;
import eventqueue.model.EventQuery;
import eventqueue.model.EventStatus;
import eventqueue.model.NewEvent;
import eventqueue.model.QueuedEvent;
import eventqueue.model.StatusCount;
import eventqueue.spi.EventQueueStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC event queue store with standard SQL implementations.
 *
 * <p>Every finalizing update is guarded on the row's current status, so a
 * transition applied to a row that has already left that status updates
 * nothing and returns {@code 0}.
 *
 * <p>Subclasses override {@link #claimPending} to provide database-specific
 * claim strategies. The default is a two-phase claim (conditional
 * {@code UPDATE} with a subquery, then a {@code SELECT} of the rows stamped
 * with this worker id) that is correct on H2. Register custom implementations via
 * {@code META-INF/services/eventqueue.jdbc.store.AbstractJdbcEventQueueStore}.
 *
 * @see JdbcEventQueueStores
 */
public abstract class AbstractJdbcEventQueueStore implements EventQueueStore {
    private static final int MAX_ERROR_LENGTH = 4000;

    protected static final String PENDING = quoted(EventStatus.PENDING);
    protected static final String CLAIMED = quoted(EventStatus.CLAIMED);
    protected static final String COMPLETED = quoted(EventStatus.COMPLETED);
    protected static final String DEAD_LETTER = quoted(EventStatus.DEAD_LETTER);

    protected static final String COLUMNS = "id, event_type, consumer_group, payload, status, " +
            "claimed_by, claimed_at, completed_at, result, error, attempt, max_attempts, " +
            "next_retry_at, source_service, correlation_id, created_at, updated_at";

    protected static final JdbcTemplate.RowMapper<QueuedEvent> EVENT_ROW_MAPPER = rs -> new QueuedEvent(
            rs.getLong("id"),
            rs.getString("event_type"),
            rs.getString("consumer_group"),
            rs.getString("payload"),
            EventStatus.fromCode(rs.getString("status")),
            rs.getString("claimed_by"),
            instant(rs, "claimed_at"),
            instant(rs, "completed_at"),
            rs.getString("result"),
            rs.getString("error"),
            rs.getInt("attempt"),
            rs.getInt("max_attempts"),
            instant(rs, "next_retry_at"),
            rs.getString("source_service"),
            rs.getString("correlation_id"),
            instant(rs, "created_at"),
            instant(rs, "updated_at"));

    private final String tableName;

    protected AbstractJdbcEventQueueStore() {
        this(TableNames.DEFAULT_TABLE);
    }

    protected AbstractJdbcEventQueueStore(String tableName) {
        this.tableName = TableNames.validate(tableName);
    }

    /**
     * Unique identifier for this store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a copy of this store that reads and writes the given table.
     */
    public abstract AbstractJdbcEventQueueStore withTableName(String tableName);

    public String tableName() {
        return tableName;
    }

    /**
     * Bind expression for a JSON column. Dialects with a native JSON type override this to cast.
     */
    protected String jsonParameter() {
        return "?";
    }

    @Override
    public long insert(Connection conn, NewEvent event, Instant now) {
        Objects.requireNonNull(event, "event");
        String sql = "INSERT INTO " + tableName + " (" +
                "event_type, consumer_group, payload, status, attempt, max_attempts, " +
                "source_service, correlation_id, created_at, updated_at" +
                ") VALUES (?,?," + jsonParameter() + ",?,0,?,?,?,?,?)";
        Timestamp ts = Timestamp.from(now);
        return JdbcTemplate.insertReturningKey(conn, sql,
                event.eventType(), event.consumerGroup(), event.payloadJson(),
                EventStatus.PENDING.code(), event.maxAttempts(),
                event.sourceService(), event.correlationId(), ts, ts);
    }

    @Override
    public List<QueuedEvent> claimPending(Connection conn, String consumerGroup, String workerId,
            Instant now, int limit) {
        Objects.requireNonNull(workerId, "workerId");
        // Truncate to millis so the stored value matches the follow-up query
        Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
        String claimSql = "UPDATE " + tableName + " SET " + claimAssignments() +
                " WHERE id IN (" +
                "SELECT id FROM " + tableName + " WHERE " + claimableCondition() +
                " ORDER BY id LIMIT ?) AND status=" + PENDING;
        int updated = JdbcTemplate.update(conn, claimSql,
                workerId, Timestamp.from(nowMs), Timestamp.from(nowMs),
                consumerGroup, Timestamp.from(now), limit);
        if (updated == 0) {
            return List.of();
        }
        return selectClaimed(conn, workerId, nowMs);
    }

    protected List<QueuedEvent> selectClaimed(Connection conn, String workerId, Instant claimedAt) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName +
                " WHERE claimed_by=? AND claimed_at=? AND status=" + CLAIMED + " ORDER BY id";
        return JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, workerId, Timestamp.from(claimedAt));
    }

    /** {@code SET} list applied to claimed rows; binds worker id, claimed_at, updated_at. */
    protected static String claimAssignments() {
        return "status=" + CLAIMED + ", claimed_by=?, claimed_at=?, attempt=attempt+1, " +
                "next_retry_at=NULL, updated_at=?";
    }

    /** Rows eligible for claiming; binds consumer group and now. */
    protected static String claimableCondition() {
        return "consumer_group=? AND status=" + PENDING +
                " AND (next_retry_at IS NULL OR next_retry_at <= ?)";
    }

    @Override
    public Optional<QueuedEvent> findById(Connection conn, long id) {
        String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
        List<QueuedEvent> rows = JdbcTemplate.query(conn, sql, EVENT_ROW_MAPPER, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    public int markCompleted(Connection conn, long id, String resultJson, Instant now) {
        String sql = "UPDATE " + tableName +
                " SET status=" + COMPLETED + ", completed_at=?, result=" + jsonParameter() +
                ", claimed_by=NULL, claimed_at=NULL, updated_at=?" +
                " WHERE id=? AND status=" + CLAIMED;
        Timestamp ts = Timestamp.from(now);
        return JdbcTemplate.update(conn, sql, ts, resultJson, ts, id);
    }

    @Override
    public int markRetry(Connection conn, long id, String error, Instant nextRetryAt, Instant now) {
        String sql = "UPDATE " + tableName +
                " SET status=" + PENDING + ", error=?, next_retry_at=?" +
                ", claimed_by=NULL, claimed_at=NULL, updated_at=?" +
                " WHERE id=? AND status=" + CLAIMED;
        // Rounded down so the stored value is never later than the requested instant
        Timestamp retryAt = Timestamp.from(nextRetryAt.truncatedTo(ChronoUnit.MILLIS));
        return JdbcTemplate.update(conn, sql, truncateError(error), retryAt, Timestamp.from(now), id);
    }

    @Override
    public int markDeadLetter(Connection conn, long id, String error, Instant now) {
        String sql = "UPDATE " + tableName +
                " SET status=" + DEAD_LETTER + ", error=?, next_retry_at=NULL" +
                ", claimed_by=NULL, claimed_at=NULL, updated_at=?" +
                " WHERE id=? AND status=" + CLAIMED;
        return JdbcTemplate.update(conn, sql, truncateError(error), Timestamp.from(now), id);
    }

    @Override
    public List<QueuedEvent> queryDeadLetter(Connection conn, String eventType, String consumerGroup, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName +
                " WHERE status=" + DEAD_LETTER);
        List<Object> params = new ArrayList<>();
        appendFilter(sql, params, "event_type", eventType);
        appendFilter(sql, params, "consumer_group", consumerGroup);
        sql.append(" ORDER BY id LIMIT ?");
        params.add(limit);
        return JdbcTemplate.query(conn, sql.toString(), EVENT_ROW_MAPPER, params.toArray());
    }

    @Override
    public int requeueDeadLetter(Connection conn, long id, Instant now) {
        String sql = "UPDATE " + tableName +
                " SET status=" + PENDING + ", attempt=0, error=NULL, next_retry_at=NULL" +
                ", claimed_by=NULL, claimed_at=NULL, updated_at=?" +
                " WHERE id=? AND status=" + DEAD_LETTER;
        return JdbcTemplate.update(conn, sql, Timestamp.from(now), id);
    }

    @Override
    public int deleteCompletedBefore(Connection conn, Instant cutoff) {
        String sql = "DELETE FROM " + tableName +
                " WHERE status=" + COMPLETED + " AND completed_at < ?";
        return JdbcTemplate.update(conn, sql, Timestamp.from(cutoff));
    }

    @Override
    public int deleteDeadLetterBefore(Connection conn, Instant cutoff) {
        String sql = "DELETE FROM " + tableName +
                " WHERE status=" + DEAD_LETTER + " AND updated_at < ?";
        return JdbcTemplate.update(conn, sql, Timestamp.from(cutoff));
    }

    @Override
    public List<StatusCount> countByConsumerGroupAndStatus(Connection conn) {
        String sql = "SELECT consumer_group, status, COUNT(*) AS cnt FROM " + tableName +
                " GROUP BY consumer_group, status ORDER BY consumer_group, status";
        return JdbcTemplate.query(conn, sql, rs -> new StatusCount(
                rs.getString("consumer_group"),
                EventStatus.fromCode(rs.getString("status")),
                rs.getLong("cnt")));
    }

    @Override
    public List<QueuedEvent> listEvents(Connection conn, EventQuery query) {
        Objects.requireNonNull(query, "query");
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM " + tableName + " WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendFilter(sql, params, "status", query.status() == null ? null : query.status().code());
        appendFilter(sql, params, "event_type", query.eventType());
        appendFilter(sql, params, "consumer_group", query.consumerGroup());
        sql.append(" ORDER BY created_at DESC, id DESC LIMIT ?");
        params.add(query.limit());
        return JdbcTemplate.query(conn, sql.toString(), EVENT_ROW_MAPPER, params.toArray());
    }

    private static void appendFilter(StringBuilder sql, List<Object> params, String column, String value) {
        if (value != null) {
            sql.append(" AND ").append(column).append("=?");
            params.add(value);
        }
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    private static String quoted(EventStatus status) {
        return "'" + status.code() + "'";
    }

    static String truncateError(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
