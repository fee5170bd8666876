package io.marketlens.analytics.merge;

import java.util.OptionalLong;

/**
 * Persists the per-table watermark: the largest emission timestamp merged into a fact table.
 */
public interface WatermarkStore {
    OptionalLong get(String table);

    void put(String table, long emittedAtMillis);
}
