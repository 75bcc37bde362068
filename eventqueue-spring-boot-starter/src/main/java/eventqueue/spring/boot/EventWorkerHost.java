package eventqueue.spring.boot;

import eventqueue.EventConsumer;
import eventqueue.worker.EventWorker;
import org.springframework.context.SmartLifecycle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one persistent {@link EventWorker} per {@link EventConsumer} bean for the lifetime
 * of the application context.
 *
 * <p>Workers start after all singletons are ready and stop before the data source is
 * closed. Stopping requests shutdown on every worker and waits up to each worker's
 * drain timeout for its current batch.
 */
public class EventWorkerHost implements SmartLifecycle {
    private static final Logger logger = Logger.getLogger(EventWorkerHost.class.getName());

    private final List<EventConsumer> consumers;
    private final Function<EventConsumer, EventWorker> workerFactory;
    private final List<EventWorker> workers = new ArrayList<>();
    private volatile boolean running;

    public EventWorkerHost(List<EventConsumer> consumers, Function<EventConsumer, EventWorker> workerFactory) {
        this.consumers = List.copyOf(Objects.requireNonNull(consumers, "consumers"));
        this.workerFactory = Objects.requireNonNull(workerFactory, "workerFactory");
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        for (EventConsumer consumer : consumers) {
            EventWorker worker = workerFactory.apply(consumer);
            worker.start();
            workers.add(worker);
        }
        running = true;
        logger.log(Level.INFO, "Started {0} event worker(s)", workers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        workers.forEach(EventWorker::requestShutdown);
        for (EventWorker worker : workers) {
            worker.close();
        }
        logger.log(Level.INFO, "Stopped {0} event worker(s)", workers.size());
        workers.clear();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /** Workers currently hosted, in consumer bean order. */
    public synchronized List<EventWorker> workers() {
        return Collections.unmodifiableList(new ArrayList<>(workers));
    }
}
