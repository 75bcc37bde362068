package eventqueue;

import java.util.Map;

/**
 * Business logic run by an {@link eventqueue.worker.EventWorker} for every event claimed
 * from one consumer group.
 *
 * <h2>Error Handling</h2>
 * <p>Returning normally completes the event and stores the returned document as its
 * result. Throwing any exception is routine control flow: the message is stored in the
 * {@code error} column and the event is retried with backoff, or dead-lettered once its
 * attempts are exhausted. It never stops the worker.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once. A consumer may see the same event again after a crash
 * between processing and finalizing, so it must tolerate repeats.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * public final class MarketDataConsumer implements EventConsumer {
 *   public String consumerGroup() { return "market_data"; }
 *
 *   public Map<String, Object> process(String eventType, Map<String, Object> payload) {
 *     List<?> assets = (List<?>) payload.get("assets");
 *     backfill(assets);
 *     return Map.of("assets_backfilled", assets.size());
 *   }
 * }
 * }</pre>
 */
public interface EventConsumer {

    /**
     * The consumer group this consumer polls. Must be non-blank.
     */
    String consumerGroup();

    /**
     * Processes one event.
     *
     * @param eventType the event type
     * @param payload   decoded payload; never {@code null}
     * @return optional result document ({@code null} stores no result)
     * @throws Exception to report a processing failure
     */
    Map<String, Object> process(String eventType, Map<String, Object> payload) throws Exception;

    /**
     * Processes one event with its full context. Override to read the correlation id or
     * attempt counter, e.g. to chain a downstream emit.
     *
     * <p>Defaults to {@link #process(String, Map)}.
     */
    default Map<String, Object> process(EventContext context) throws Exception {
        return process(context.eventType(), context.payload());
    }
}
