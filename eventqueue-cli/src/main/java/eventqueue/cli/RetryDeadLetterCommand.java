package eventqueue.cli;

import eventqueue.maintenance.QueueMaintenance;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "retry-dead-letter", description = "Re-queue dead-letter events for retry.")
class RetryDeadLetterCommand implements Callable<Integer> {

    @ParentCommand
    EventQueueCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = "--event-type", description = "Only retry events of this type")
    String eventType;

    @Option(names = "--consumer-group", description = "Only retry events for this consumer group")
    String consumerGroup;

    @Option(names = "--limit", defaultValue = "" + QueueMaintenance.DEFAULT_RETRY_LIMIT,
            description = "Maximum events to retry (default: ${DEFAULT-VALUE})")
    int limit;

    @Override
    public Integer call() {
        int count;
        try (EventQueueCommand.QueueSession session = parent.openSession()) {
            count = session.maintenance().retryDeadLetter(eventType, consumerGroup, limit);
        }
        spec.commandLine().getOut().printf("Re-queued %d dead-letter events for retry.%n", count);
        spec.commandLine().getOut().flush();
        return 0;
    }
}
