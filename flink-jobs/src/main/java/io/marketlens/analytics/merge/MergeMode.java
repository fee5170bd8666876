package io.marketlens.analytics.merge;

/**
 * INCREMENTAL honours the watermark and lookback window; FULL_REFRESH reprocesses every record
 * and recomputes every staged key.
 */
public enum MergeMode {
    INCREMENTAL,
    FULL_REFRESH
}
