package io.marketlens.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceField;

import java.util.List;

/**
 * Resolves canonical fields against a raw payload using a source definition's candidate paths.
 */
public final class PayloadFields {
    private final JsonNode root;
    private final SourceDefinition definition;

    public PayloadFields(JsonNode root, SourceDefinition definition) {
        this.root = root;
        this.definition = definition;
    }

    /**
     * First non-blank text among the field's candidate paths, or null.
     */
    public String text(SourceField field) {
        return firstText(root, definition.paths(field));
    }

    public boolean present(SourceField field) {
        return text(field) != null;
    }

    static String firstText(JsonNode root, List<String> paths) {
        for (String path : paths) {
            String value = scalarText(at(root, path));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * Looks up a literal key first, then walks dot-separated segments.
     */
    static JsonNode at(JsonNode root, String path) {
        if (root == null || path == null) {
            return null;
        }
        JsonNode literal = root.get(path);
        if (literal != null || path.indexOf('.') < 0) {
            return literal;
        }
        JsonNode current = root;
        for (String segment : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    // Action-list metrics arrive as [{"action_type": ..., "value": ...}]; the first value is used.
    private static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isArray()) {
            return node.size() == 0 ? null : scalarText(node.get(0));
        }
        if (node.isObject()) {
            return scalarText(node.get("value"));
        }
        String value = node.asText();
        return value == null || value.isBlank() ? null : value.trim();
    }
}
