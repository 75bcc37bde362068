/**
 * Queue maintenance: pruning of terminal events, bulk dead-letter retry and inspection.
 *
 * <p>{@link eventqueue.maintenance.QueueMaintenance} is a connection-managed facade over
 * the {@link eventqueue.spi.EventQueueStore} maintenance methods;
 * {@link eventqueue.maintenance.CleanupScheduler} runs the pruning on a schedule.
 */
package eventqueue.maintenance;
