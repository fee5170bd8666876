package io.marketlens.analytics.source;

/**
 * Canonical fact family a source feeds.
 */
public enum SourceEntityType {
    AD_PERFORMANCE,
    ORDER
}
