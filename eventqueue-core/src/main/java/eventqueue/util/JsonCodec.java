package eventqueue.util;

import java.util.Map;

/**
 * Codec for the opaque payload and result documents stored with each event.
 *
 * <p>The queue itself never looks inside a document; only the producer (encoding the
 * caller's payload) and the worker (decoding it for the consumer, encoding the result)
 * use this codec. The default implementation is {@link JacksonJsonCodec}.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a document as a JSON object string. A {@code null} document encodes as {@code "{}"}.
     *
     * @param document arbitrary nested map/list/scalar values
     * @return JSON text
     * @throws IllegalArgumentException if a value cannot be serialized
     */
    String toJson(Map<String, Object> document);

    /**
     * Parses a JSON object string. Returns an empty map for {@code null}, empty, or
     * {@code "null"} input.
     *
     * @param json the JSON text
     * @return parsed document (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
