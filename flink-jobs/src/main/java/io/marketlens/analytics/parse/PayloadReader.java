package io.marketlens.analytics.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.util.JsonSupport;

/**
 * Parses raw payload text into a JSON object tree.
 */
final class PayloadReader {
    private PayloadReader() {}

    /**
     * @return the payload object, or null when the text is absent, not JSON, or not an object
     */
    static JsonNode readObject(String payload) {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            JsonNode root = JsonSupport.MAPPER.readTree(payload);
            return root != null && root.isObject() ? root : null;
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
