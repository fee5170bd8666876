package io.marketlens.analytics.merge;

import io.marketlens.analytics.parse.DropReason;
import io.marketlens.analytics.source.SourceEntityType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters describing one merge run for one entity type.
 */
public final class MergeResult {
    private final SourceEntityType entityType;
    private final MergeMode mode;
    private final long watermarkBefore;
    private final long watermarkAfter;
    private final int recordsReceived;
    private final int recordsSelected;
    private final int rowsStaged;
    private final Map<DropReason, Integer> dropped;
    private final int factsInserted;
    private final int factsUpdated;

    MergeResult(
            SourceEntityType entityType,
            MergeMode mode,
            long watermarkBefore,
            long watermarkAfter,
            int recordsReceived,
            int recordsSelected,
            int rowsStaged,
            Map<DropReason, Integer> dropped,
            int factsInserted,
            int factsUpdated) {
        this.entityType = entityType;
        this.mode = mode;
        this.watermarkBefore = watermarkBefore;
        this.watermarkAfter = watermarkAfter;
        this.recordsReceived = recordsReceived;
        this.recordsSelected = recordsSelected;
        this.rowsStaged = rowsStaged;
        EnumMap<DropReason, Integer> copy = new EnumMap<>(DropReason.class);
        copy.putAll(dropped);
        this.dropped = Collections.unmodifiableMap(copy);
        this.factsInserted = factsInserted;
        this.factsUpdated = factsUpdated;
    }

    public SourceEntityType entityType() {
        return entityType;
    }

    public MergeMode mode() {
        return mode;
    }

    public long watermarkBefore() {
        return watermarkBefore;
    }

    public long watermarkAfter() {
        return watermarkAfter;
    }

    public int recordsReceived() {
        return recordsReceived;
    }

    public int recordsSelected() {
        return recordsSelected;
    }

    public int recordsSkippedByWatermark() {
        return recordsReceived - recordsSelected;
    }

    public int rowsStaged() {
        return rowsStaged;
    }

    public Map<DropReason, Integer> dropped() {
        return dropped;
    }

    public int droppedCount(DropReason reason) {
        return dropped.getOrDefault(reason, 0);
    }

    public int totalDropped() {
        int total = 0;
        for (int count : dropped.values()) {
            total += count;
        }
        return total;
    }

    public int factsInserted() {
        return factsInserted;
    }

    public int factsUpdated() {
        return factsUpdated;
    }

    @Override
    public String toString() {
        return "MergeResult{" + entityType + ", mode=" + mode
                + ", received=" + recordsReceived
                + ", selected=" + recordsSelected
                + ", staged=" + rowsStaged
                + ", dropped=" + dropped
                + ", inserted=" + factsInserted
                + ", updated=" + factsUpdated
                + ", watermark=" + watermarkBefore + "->" + watermarkAfter + "}";
    }
}
