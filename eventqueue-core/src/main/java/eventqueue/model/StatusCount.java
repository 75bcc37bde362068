package eventqueue.model;

/**
 * Number of events in one consumer group with one status.
 */
public record StatusCount(String consumerGroup, EventStatus status, long count) {
}
