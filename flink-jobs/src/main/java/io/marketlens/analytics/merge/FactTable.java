package io.marketlens.analytics.merge;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Keyed canonical table with batch upserts.
 *
 * <p>A whole batch is applied under one write lock, so readers observe either none or all of it.
 * Reads return snapshots taken under the read lock. Stored rows are treated as immutable:
 * merges always produce a new row rather than editing the stored one.</p>
 */
public class FactTable<T> {
    private final String name;
    private final Function<T, String> keyFn;
    private final Function<T, String> tenantFn;
    private final ToLongFunction<T> ingestedAtFn;
    private final Map<String, T> rows = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FactTable(
            String name,
            Function<T, String> keyFn,
            Function<T, String> tenantFn,
            ToLongFunction<T> ingestedAtFn) {
        this.name = name;
        this.keyFn = keyFn;
        this.tenantFn = tenantFn;
        this.ingestedAtFn = ingestedAtFn;
    }

    public String name() {
        return name;
    }

    /**
     * Applies a batch. For keys already present, {@code merge.apply(existing, incoming)} decides the
     * stored row.
     */
    public UpsertCounts upsertAll(Collection<T> batch, BinaryOperator<T> merge) {
        int inserted = 0;
        int updated = 0;
        lock.writeLock().lock();
        try {
            for (T incoming : batch) {
                String key = Objects.requireNonNull(keyFn.apply(incoming), "row key");
                T existing = rows.get(key);
                if (existing == null) {
                    rows.put(key, incoming);
                    inserted++;
                } else {
                    T merged = merge.apply(existing, incoming);
                    if (merged != existing) {
                        rows.put(key, merged);
                        updated++;
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return new UpsertCounts(inserted, updated);
    }

    public T get(String key) {
        lock.readLock().lock();
        try {
            return rows.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<T> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(rows.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rows owned by one tenant. A null tenant is rejected rather than matching nothing silently.
     */
    public List<T> rowsForTenant(String tenantId) {
        Objects.requireNonNull(tenantId, "tenantId");
        List<T> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (T row : rows.values()) {
                if (tenantId.equals(tenantFn.apply(row))) {
                    result.add(row);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return result;
    }

    /**
     * @return the largest ingestion timestamp present, or 0 (the epoch) for an empty table
     */
    public long maxIngestedAt() {
        long max = 0L;
        lock.readLock().lock();
        try {
            for (T row : rows.values()) {
                max = Math.max(max, ingestedAtFn.applyAsLong(row));
            }
        } finally {
            lock.readLock().unlock();
        }
        return max;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Row counts of one batch upsert. Rows whose merge kept the stored row count as neither.
     */
    public static final class UpsertCounts {
        private final int inserted;
        private final int updated;

        public UpsertCounts(int inserted, int updated) {
            this.inserted = inserted;
            this.updated = updated;
        }

        public int inserted() {
            return inserted;
        }

        public int updated() {
            return updated;
        }
    }
}
