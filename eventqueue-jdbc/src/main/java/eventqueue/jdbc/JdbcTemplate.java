package eventqueue.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lightweight JDBC helper to reduce boilerplate in event store implementations.
 * Every {@link SQLException} is rethrown as {@link EventQueueStoreException}.
 */
public final class JdbcTemplate {

    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    /** Execute UPDATE or DELETE, return rows affected. */
    public static int update(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new EventQueueStoreException("Failed to execute update", e);
        }
    }

    /** Execute INSERT into a table whose first column is a generated {@code BIGINT} key; return the key. */
    public static long insertReturningKey(Connection conn, String sql, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bindParams(ps, params);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new EventQueueStoreException("Insert returned no generated key", null);
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new EventQueueStoreException("Failed to execute insert", e);
        }
    }

    /** Execute SELECT, map rows. */
    public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new EventQueueStoreException("Failed to execute query", e);
        }
    }

    /** Execute UPDATE ... RETURNING, map returned rows (PostgreSQL). */
    public static <T> List<T> updateReturning(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindParams(ps, params);
            return mapAll(ps, mapper);
        } catch (SQLException e) {
            throw new EventQueueStoreException("Failed to execute updateReturning", e);
        }
    }

    /** Returns {@code n} comma-separated placeholders, e.g. {@code ?,?,?}. */
    public static String placeholders(int n) {
        return String.join(",", Collections.nCopies(n, "?"));
    }

    private static <T> List<T> mapAll(PreparedStatement ps, RowMapper<T> mapper) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<T> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapper.map(rs));
            }
            return results;
        }
    }

    private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
        for (int i = 0; i < params.length; i++) {
            Object param = params[i];
            if (param == null) {
                ps.setObject(i + 1, null);
            } else if (param instanceof String s) {
                ps.setString(i + 1, s);
            } else if (param instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else if (param instanceof Long n) {
                ps.setLong(i + 1, n);
            } else if (param instanceof Timestamp ts) {
                ps.setTimestamp(i + 1, ts);
            } else {
                ps.setObject(i + 1, param);
            }
        }
    }

    private JdbcTemplate() {}
}
