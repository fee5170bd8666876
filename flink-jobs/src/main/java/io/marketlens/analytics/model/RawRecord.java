package io.marketlens.analytics.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One raw payload emitted by the ingestion layer for a single source connection.
 *
 * <p>Raw records are immutable once emitted; a newer emission of the same logical row
 * supersedes an older one during merging.</p>
 */
public class RawRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String ingestionId;
    /** Source definition name, e.g. {@code meta_ads} or {@code shopify_orders}. */
    public String sourceName;
    /** Upstream connection identifier; null when the source carries no connection metadata. */
    public String connectionId;
    public long emittedAtMillis;
    public String payload;

    public RawRecord() {}

    public RawRecord(String ingestionId, String sourceName, String connectionId, long emittedAtMillis, String payload) {
        this.ingestionId = ingestionId;
        this.sourceName = sourceName;
        this.connectionId = connectionId;
        this.emittedAtMillis = emittedAtMillis;
        this.payload = payload;
    }

    public Instant emittedAt() {
        return Instant.ofEpochMilli(emittedAtMillis);
    }
}
