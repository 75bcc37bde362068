package eventqueue.spring;

import eventqueue.jdbc.DataSourceConnectionProvider;
import eventqueue.jdbc.store.H2EventQueueStore;
import eventqueue.producer.EventProducer;
import eventqueue.registry.PipelineEvents;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpringTxContextTest {
    private JdbcDataSource dataSource;
    private SpringTxContext txContext;
    private TransactionTemplate transactions;
    private EventProducer producer;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:eventqueue_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        createSchema();

        txContext = new SpringTxContext(dataSource);
        transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        producer = EventProducer.builder()
                .connectionProvider(new DataSourceConnectionProvider(dataSource))
                .store(new H2EventQueueStore())
                .registry(PipelineEvents.defaultRegistry())
                .txContext(txContext)
                .build();
    }

    @Test
    void noTransactionOutsideTemplate() {
        assertFalse(txContext.isTransactionActive());
        assertThrows(IllegalStateException.class, txContext::currentConnection);
    }

    @Test
    void emitCommitsWithSpringTransaction() throws Exception {
        List<Long> ids = transactions.execute(status -> {
            assertTrue(txContext.isTransactionActive());
            return producer.emit(PipelineEvents.PREDICTION_CREATED, Map.of("ticker", "TSLA"), "analyzer");
        });

        assertEquals(2, ids.size());
        assertEquals(2, countRows());
    }

    @Test
    void emitRollsBackWithSpringTransaction() throws Exception {
        assertThrows(IllegalStateException.class, () -> transactions.executeWithoutResult(status -> {
            producer.emit(PipelineEvents.SIGNALS_STORED, Map.of("count", 4), "s3_processor");
            throw new IllegalStateException("prediction insert failed");
        }));

        assertEquals(0, countRows());
    }

    @Test
    void emitUsesTheTransactionConnection() {
        transactions.executeWithoutResult(status -> {
            Connection first = txContext.currentConnection();
            Connection second = txContext.currentConnection();
            assertEquals(first, second);
        });
    }

    private int countRows() throws SQLException {
        try (Connection conn = dataSource.getConnection();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM events")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private void createSchema() throws Exception {
        String schema;
        try (InputStream is = getClass().getResourceAsStream("/schema/h2.sql")) {
            schema = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            for (String sql : schema.split(";")) {
                if (!sql.isBlank()) {
                    stmt.execute(sql.trim());
                }
            }
        }
    }
}
