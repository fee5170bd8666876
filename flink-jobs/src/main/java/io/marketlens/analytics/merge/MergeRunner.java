package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceEntityType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Splits a batch of raw records by entity type and merges each type on its own worker.
 *
 * <p>Each entity type is merged single-threaded; the first failure of any type is rethrown after
 * the remaining types finish.</p>
 */
public class MergeRunner implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MergeRunner.class);

    private final IncrementalMergeEngine engine;
    private final SourceCatalog catalog;
    private final ExecutorService executor;

    public MergeRunner(IncrementalMergeEngine engine, SourceCatalog catalog, int parallelism) {
        this.engine = engine;
        this.catalog = catalog;
        this.executor = Executors.newFixedThreadPool(Math.max(1, parallelism));
    }

    public Map<SourceEntityType, MergeResult> run(Collection<RawRecord> records, MergeMode mode) {
        List<RawRecord> adRecords = new ArrayList<>();
        List<RawRecord> orderRecords = new ArrayList<>();
        int unknown = 0;
        for (RawRecord record : records) {
            SourceDefinition definition = catalog.find(record.sourceName);
            if (definition == null) {
                unknown++;
                continue;
            }
            if (definition.entityType() == SourceEntityType.ORDER) {
                orderRecords.add(record);
            } else {
                adRecords.add(record);
            }
        }
        if (unknown > 0) {
            LOG.warn("Skipped {} records with no source definition", unknown);
        }

        Map<SourceEntityType, Future<MergeResult>> futures = new EnumMap<>(SourceEntityType.class);
        futures.put(SourceEntityType.AD_PERFORMANCE, submit(() -> engine.mergeAdPerformance(adRecords, mode)));
        futures.put(SourceEntityType.ORDER, submit(() -> engine.mergeOrders(orderRecords, mode)));

        Map<SourceEntityType, MergeResult> results = new EnumMap<>(SourceEntityType.class);
        RuntimeException failure = null;
        for (Map.Entry<SourceEntityType, Future<MergeResult>> entry : futures.entrySet()) {
            try {
                results.put(entry.getKey(), entry.getValue().get());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while merging " + entry.getKey(), ex);
            } catch (ExecutionException ex) {
                LOG.error("Merge failed for entity type {}", entry.getKey(), ex.getCause());
                if (failure == null) {
                    failure = unwrap(entry.getKey(), ex);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    private Future<MergeResult> submit(Callable<MergeResult> task) {
        return executor.submit(task);
    }

    private static RuntimeException unwrap(SourceEntityType type, ExecutionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Merge failed for " + type, cause);
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
