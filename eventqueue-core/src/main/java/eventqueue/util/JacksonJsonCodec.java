package eventqueue.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Nested objects decode as {@link LinkedHashMap}, arrays as {@link java.util.List},
 * numbers as the narrowest Jackson default ({@code Integer}, {@code Long}, {@code Double}).
 */
public final class JacksonJsonCodec implements JsonCodec {
    static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * Creates a codec using an application-supplied mapper (e.g. the Spring Boot one).
     */
    public JacksonJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String toJson(Map<String, Object> document) {
        if (document == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize document: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public Map<String, Object> parseObject(String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> parsed = objectMapper.readValue(json, DOCUMENT);
            return parsed == null ? new LinkedHashMap<>() : parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON object: " + e.getOriginalMessage(), e);
        }
    }
}
