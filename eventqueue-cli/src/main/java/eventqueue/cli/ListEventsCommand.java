package eventqueue.cli;

import eventqueue.model.EventQuery;
import eventqueue.model.EventStatus;
import eventqueue.model.QueuedEvent;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "list", description = "List recent events, newest first.")
class ListEventsCommand implements Callable<Integer> {
    private static final DateTimeFormatter CREATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    @ParentCommand
    EventQueueCommand parent;

    @Spec
    CommandSpec spec;

    @Option(names = "--status", converter = EventStatusConverter.class,
            description = "Filter by status: pending, claimed, completed, failed, dead_letter")
    EventStatus status;

    @Option(names = "--event-type", description = "Filter by event type")
    String eventType;

    @Option(names = "--consumer-group", description = "Filter by consumer group")
    String consumerGroup;

    @Option(names = "--limit", defaultValue = "20", description = "Maximum events to show (default: ${DEFAULT-VALUE})")
    int limit;

    @Override
    public Integer call() {
        EventQuery query = EventQuery.builder()
                .status(status)
                .eventType(eventType)
                .consumerGroup(consumerGroup)
                .limit(Math.max(limit, 0))
                .build();
        List<QueuedEvent> events;
        try (EventQueueCommand.QueueSession session = parent.openSession()) {
            events = session.maintenance().listEvents(query);
        }
        PrintWriter out = spec.commandLine().getOut();
        if (events.isEmpty()) {
            out.println("No events found.");
            return 0;
        }

        out.println();
        out.printf("%6s %-22s %-16s %-12s %7s %-20s%n", "ID", "Type", "Consumer", "Status", "Attempt", "Created");
        out.println("-".repeat(90));
        for (QueuedEvent e : events) {
            String created = e.createdAt() == null ? "-" : CREATED_FORMAT.format(e.createdAt());
            out.printf("%6d %-22s %-16s %-12s %3d/%-3d %-20s%n",
                    e.id(), e.eventType(), e.consumerGroup(), e.status().code(),
                    e.attempt(), e.maxAttempts(), created);
        }
        out.flush();
        return 0;
    }

    static final class EventStatusConverter implements CommandLine.ITypeConverter<EventStatus> {
        @Override
        public EventStatus convert(String value) {
            try {
                return EventStatus.fromCode(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
