package io.marketlens.analytics.parse;

import java.util.Objects;

/**
 * Outcome of extracting one raw record: either a row or the reason it was dropped.
 */
public final class Extraction<T> {
    private final T row;
    private final DropReason dropReason;
    private final String detail;

    private Extraction(T row, DropReason dropReason, String detail) {
        this.row = row;
        this.dropReason = dropReason;
        this.detail = detail;
    }

    public static <T> Extraction<T> of(T row) {
        return new Extraction<>(Objects.requireNonNull(row, "row"), null, null);
    }

    public static <T> Extraction<T> dropped(DropReason reason, String detail) {
        return new Extraction<>(null, Objects.requireNonNull(reason, "reason"), detail);
    }

    public boolean isDropped() {
        return dropReason != null;
    }

    public T row() {
        return row;
    }

    public DropReason dropReason() {
        return dropReason;
    }

    public String detail() {
        return detail;
    }
}
