package eventqueue.registry;

/**
 * Event types and consumer groups of the default harvesting pipeline.
 *
 * <pre>
 * posts_harvested    -> s3_processor
 * signals_stored     -> analyzer
 * prediction_created -> market_data, notifications
 * prices_backfilled  -> (terminal)
 * </pre>
 *
 * <p>Payload keys by type (documentation only, never validated):
 * <ul>
 *   <li>{@code posts_harvested}: {@code s3_keys}, {@code source}, {@code count}, {@code mode}</li>
 *   <li>{@code signals_stored}: {@code signal_ids}, {@code source}, {@code count}</li>
 *   <li>{@code prediction_created}: {@code prediction_id}, {@code signal_id}, {@code shitpost_id},
 *       {@code assets}, {@code confidence}, {@code analysis_status}</li>
 *   <li>{@code prices_backfilled}: {@code symbols}, {@code prediction_id},
 *       {@code assets_backfilled}, {@code outcomes_calculated}</li>
 * </ul>
 */
public final class PipelineEvents {
    public static final String POSTS_HARVESTED = "posts_harvested";
    public static final String SIGNALS_STORED = "signals_stored";
    public static final String PREDICTION_CREATED = "prediction_created";
    public static final String PRICES_BACKFILLED = "prices_backfilled";

    public static final String S3_PROCESSOR = "s3_processor";
    public static final String ANALYZER = "analyzer";
    public static final String MARKET_DATA = "market_data";
    public static final String NOTIFICATIONS = "notifications";

    private static final ConsumerRegistry DEFAULT = ConsumerRegistry.builder()
            .register(POSTS_HARVESTED, S3_PROCESSOR)
            .register(SIGNALS_STORED, ANALYZER)
            .register(PREDICTION_CREATED, MARKET_DATA, NOTIFICATIONS)
            .terminal(PRICES_BACKFILLED)
            .build();

    private PipelineEvents() {}

    public static ConsumerRegistry defaultRegistry() {
        return DEFAULT;
    }
}
