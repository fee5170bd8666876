package io.marketlens.analytics.util;

import java.util.Locale;

/**
 * Shared string semantics for blank handling and deterministic fallbacks.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    /**
     * Trims the value; blank input becomes null, never the empty string.
     */
    public static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    public static String lowerTrimOrNull(String value) {
        String trimmed = trimToNull(value);
        return trimmed == null ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }
}
