package eventqueue.cli;

import eventqueue.model.EventStatus;
import eventqueue.model.StatusCount;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "queue-stats", description = "Show event counts grouped by consumer group and status.")
class QueueStatsCommand implements Callable<Integer> {
    private static final String RULE = "-".repeat(45);

    @ParentCommand
    EventQueueCommand parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        List<StatusCount> rows;
        try (EventQueueCommand.QueueSession session = parent.openSession()) {
            rows = session.maintenance().queueStats();
        }
        PrintWriter out = spec.commandLine().getOut();
        if (rows.isEmpty()) {
            out.println("Event queue is empty.");
            return 0;
        }

        out.println();
        out.printf("%-20s %-15s %8s%n", "Consumer Group", "Status", "Count");
        out.println(RULE);
        long total = 0;
        Map<EventStatus, Long> byStatus = new EnumMap<>(EventStatus.class);
        for (StatusCount row : rows) {
            out.printf("%-20s %-15s %8d%n", row.consumerGroup(), row.status().code(), row.count());
            total += row.count();
            byStatus.merge(row.status(), row.count(), Long::sum);
        }
        out.println(RULE);
        out.printf("Total: %d  (pending=%d, claimed=%d, completed=%d, failed=%d, dead_letter=%d)%n",
                total,
                byStatus.getOrDefault(EventStatus.PENDING, 0L),
                byStatus.getOrDefault(EventStatus.CLAIMED, 0L),
                byStatus.getOrDefault(EventStatus.COMPLETED, 0L),
                byStatus.getOrDefault(EventStatus.FAILED, 0L),
                byStatus.getOrDefault(EventStatus.DEAD_LETTER, 0L));
        out.flush();
        return 0;
    }
}
