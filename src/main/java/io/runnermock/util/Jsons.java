package io.runnermock.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson setup. Response bodies go out compact, the way the real API
 * sends them; {@link #pretty(String)} is for humans reading CLI output.
 */
public final class Jsons {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static JsonNode readTree(String json) throws JsonProcessingException {
        return MAPPER.readTree(json == null ? "" : json);
    }

    /** Re-indents a JSON document; text that is not JSON comes back unchanged. */
    public static String pretty(String json) {
        try {
            JsonNode node = readTree(json);
            return node == null || node.isMissingNode()
                    ? json
                    : MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return json;
        }
    }
}
