package eventqueue.cli;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import eventqueue.jdbc.DataSourceConnectionProvider;
import eventqueue.jdbc.TableNames;
import eventqueue.jdbc.store.AbstractJdbcEventQueueStore;
import eventqueue.jdbc.store.JdbcEventQueueStores;
import eventqueue.maintenance.QueueMaintenance;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Operator command line for inspecting and maintaining the event queue.
 *
 * <p>Exit codes: {@code 0} success, {@code 2} usage error, {@code 1} internal error.
 */
@Command(name = "eventqueue", mixinStandardHelpOptions = true, version = "eventqueue 0.3.0",
        description = "Inspect and maintain the event queue.",
        subcommands = {
                QueueStatsCommand.class,
                ListEventsCommand.class,
                RetryDeadLetterCommand.class,
                CleanupCommand.class
        })
public class EventQueueCommand implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(EventQueueCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Option(names = "--jdbc-url", defaultValue = "${env:EVENTQUEUE_JDBC_URL}",
            description = "JDBC URL of the event database (default: $EVENTQUEUE_JDBC_URL)")
    String jdbcUrl;

    @Option(names = "--user", defaultValue = "${env:EVENTQUEUE_DB_USER}",
            description = "Database user (default: $EVENTQUEUE_DB_USER)")
    String user;

    @Option(names = "--password", defaultValue = "${env:EVENTQUEUE_DB_PASSWORD}",
            description = "Database password (default: $EVENTQUEUE_DB_PASSWORD)")
    String password;

    @Option(names = "--table-name", defaultValue = TableNames.DEFAULT_TABLE,
            description = "Event table name (default: ${DEFAULT-VALUE})")
    String tableName;

    public static void main(String[] args) {
        configureLogging();
        System.exit(commandLine().execute(args));
    }

    /**
     * Builds the command line with the error handling used by {@link #main}.
     */
    public static CommandLine commandLine() {
        return new CommandLine(new EventQueueCommand())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    logger.log(Level.SEVERE, "Command failed", ex);
                    cmd.getErr().println("Error: " + ex.getMessage());
                    return cmd.getCommandSpec().exitCodeOnExecutionException();
                });
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return spec.exitCodeOnInvalidInput();
    }

    /**
     * Opens a pooled connection to the configured database.
     *
     * @throws CommandLine.ParameterException if no JDBC URL is configured
     */
    QueueSession openSession() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing JDBC URL: pass --jdbc-url or set EVENTQUEUE_JDBC_URL");
        }
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(user);
        config.setPassword(password);
        config.setMaximumPoolSize(2);
        config.setPoolName("eventqueue-cli");
        HikariDataSource dataSource = new HikariDataSource(config);
        try {
            AbstractJdbcEventQueueStore store = JdbcEventQueueStores.detect(jdbcUrl, tableName);
            return new QueueSession(dataSource,
                    new QueueMaintenance(new DataSourceConnectionProvider(dataSource), store));
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    private static void configureLogging() {
        try (InputStream in = EventQueueCommand.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not load logging.properties", e);
        }
    }

    /**
     * Maintenance facade bound to a pool that is closed with the session.
     */
    record QueueSession(HikariDataSource dataSource, QueueMaintenance maintenance) implements AutoCloseable {
        @Override
        public void close() {
            dataSource.close();
        }
    }
}
