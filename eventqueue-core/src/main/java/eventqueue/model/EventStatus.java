package eventqueue.model;

/**
 * Lifecycle states of a queued event.
 *
 * <pre>
 * pending -> claimed -> completed
 *                    -> failed -> pending (retry with backoff)
 *                              -> dead_letter (attempts exhausted)
 * dead_letter -> pending (manual retry only)
 * </pre>
 *
 * <p>Each constant carries the lower-case code persisted in the {@code status} column.
 */
public enum EventStatus {
    PENDING("pending"),
    CLAIMED("claimed"),
    COMPLETED("completed"),
    FAILED("failed"),
    DEAD_LETTER("dead_letter");

    private final String code;

    EventStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Returns {@code true} for states a worker never leaves on its own.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTER;
    }

    /**
     * Resolves a persisted status code.
     *
     * @param code the code stored in the database, e.g. {@code "dead_letter"}
     * @return the matching status
     * @throws IllegalArgumentException if the code is unknown
     */
    public static EventStatus fromCode(String code) {
        for (EventStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown event status: " + code);
    }
}
