package eventqueue;

import eventqueue.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JDBC connections for unit tests that never touch a database.
 */
public final class TestConnections {

    private TestConnections() {}

    public static Connection dummyConnection() {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> method.getReturnType() == boolean.class ? Boolean.FALSE : null);
    }

    public static ConnectionProvider dummyProvider() {
        return TestConnections::dummyConnection;
    }

    public static ConnectionProvider failingProvider() {
        return () -> { throw new SQLException("connection failed"); };
    }

    /**
     * Connection provider counting commits and rollbacks across all handed-out connections.
     */
    public static final class CountingProvider implements ConnectionProvider {
        public final AtomicInteger commits = new AtomicInteger();
        public final AtomicInteger rollbacks = new AtomicInteger();

        @Override
        public Connection getConnection() {
            return (Connection) Proxy.newProxyInstance(
                    Connection.class.getClassLoader(),
                    new Class<?>[]{Connection.class},
                    (proxy, method, args) -> {
                        switch (method.getName()) {
                            case "commit":
                                commits.incrementAndGet();
                                return null;
                            case "rollback":
                                rollbacks.incrementAndGet();
                                return null;
                            default:
                                return method.getReturnType() == boolean.class ? Boolean.FALSE : null;
                        }
                    });
        }
    }
}
