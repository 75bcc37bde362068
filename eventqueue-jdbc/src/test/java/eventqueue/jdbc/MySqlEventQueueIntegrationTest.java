package eventqueue.jdbc;

import eventqueue.jdbc.store.AbstractJdbcEventQueueStore;
import eventqueue.jdbc.store.MySqlEventQueueStore;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class MySqlEventQueueIntegrationTest extends AbstractEventQueueIntegrationTest {

    @Container
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
            .withDatabaseName("eventqueue_test");

    private static final MySqlEventQueueStore STORE = new MySqlEventQueueStore();
    private static SimpleDataSource dataSource;

    @BeforeAll
    static void initSchema() throws Exception {
        dataSource = SimpleDataSource.of(mysql);
        Schemas.apply(dataSource, "/schema/mysql.sql");
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("TRUNCATE TABLE events");
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
