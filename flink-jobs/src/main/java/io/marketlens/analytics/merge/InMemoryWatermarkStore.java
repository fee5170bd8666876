package io.marketlens.analytics.merge;

import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local watermark store.
 */
public class InMemoryWatermarkStore implements WatermarkStore {
    private final Map<String, Long> watermarks = new ConcurrentHashMap<>();

    @Override
    public OptionalLong get(String table) {
        Long value = watermarks.get(table);
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public void put(String table, long emittedAtMillis) {
        watermarks.put(table, emittedAtMillis);
    }
}
