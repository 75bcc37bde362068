package eventqueue.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

@Command(name = "cleanup", description = "Delete old completed and dead-letter events.")
class CleanupCommand implements Callable<Integer> {

    @ParentCommand
    EventQueueCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = "--completed-days", defaultValue = "7",
            description = "Delete completed events older than N days (default: ${DEFAULT-VALUE})")
    int completedDays;

    @Option(names = "--dead-letter-days", defaultValue = "30",
            description = "Delete dead-letter events older than N days (default: ${DEFAULT-VALUE})")
    int deadLetterDays;

    @Override
    public Integer call() {
        int completed;
        int dead;
        try (EventQueueCommand.QueueSession session = parent.openSession()) {
            completed = session.maintenance().pruneCompleted(Duration.ofDays(completedDays));
            dead = session.maintenance().pruneDeadLetter(Duration.ofDays(deadLetterDays));
        }
        PrintWriter out = spec.commandLine().getOut();
        out.printf("Deleted %d completed events (>%d days old)%n", completed, completedDays);
        out.printf("Deleted %d dead-letter events (>%d days old)%n", dead, deadLetterDays);
        out.flush();
        return 0;
    }
}
