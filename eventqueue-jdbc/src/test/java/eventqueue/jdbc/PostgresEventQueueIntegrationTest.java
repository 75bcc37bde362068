package eventqueue.jdbc;

import eventqueue.jdbc.store.AbstractJdbcEventQueueStore;
import eventqueue.jdbc.store.PostgresEventQueueStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class PostgresEventQueueIntegrationTest extends AbstractEventQueueIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("eventqueue_test");

    private static final PostgresEventQueueStore STORE = new PostgresEventQueueStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = SimpleDataSource.of(postgres);
        Schemas.apply(dataSource, "/schema/postgresql.sql");
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE TABLE events RESTART IDENTITY");
        }
    }

    @Override
    DataSource dataSource() {
        return dataSource;
    }

    @Override
    AbstractJdbcEventQueueStore store() {
        return STORE;
    }
}
