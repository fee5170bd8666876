package io.marketlens.analytics.merge;

import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.model.StagedAdRow;
import io.marketlens.analytics.parse.AdRecordExtractor;
import io.marketlens.analytics.parse.DropReason;
import io.marketlens.analytics.parse.Extraction;
import io.marketlens.analytics.parse.OrderRecordExtractor;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.source.SourceDefinition;
import io.marketlens.analytics.source.SourceEntityType;
import io.marketlens.analytics.tenant.TenantResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges raw records into the staging table and canonical fact tables.
 *
 * <p>A run reads the table watermark {@code T}, selects records emitted after
 * {@code T - lookback(source)}, extracts and validates them, keeps the latest emission per natural
 * key, and upserts. Campaign facts are recomputed from all staging rows of every touched
 * campaign-date key, so a late-arriving correction replaces the stored totals instead of adding to
 * them. Extraction finishes before any table is written: a tenant registry failure or ambiguous
 * tenant mapping aborts the run without partial writes.</p>
 *
 * <p>Runs for one entity type are serialized on the store's merge lock; different entity types
 * may run concurrently.</p>
 */
public class IncrementalMergeEngine {
    private static final Logger LOG = LoggerFactory.getLogger(IncrementalMergeEngine.class);

    private final SourceCatalog catalog;
    private final PipelineConfig config;
    private final FactStore store;
    private final WatermarkStore watermarks;
    private final AdRecordExtractor adExtractor;
    private final OrderRecordExtractor orderExtractor;

    public IncrementalMergeEngine(
            SourceCatalog catalog,
            TenantResolver tenantResolver,
            PipelineConfig config,
            FactStore store,
            WatermarkStore watermarks) {
        this.catalog = catalog;
        this.config = config;
        this.store = store;
        this.watermarks = watermarks;
        this.adExtractor = new AdRecordExtractor(tenantResolver);
        this.orderExtractor = new OrderRecordExtractor(tenantResolver);
    }

    public FactStore store() {
        return store;
    }

    public MergeResult mergeAdPerformance(Collection<RawRecord> records, MergeMode mode) {
        ReentrantLock lock = store.mergeLock(SourceEntityType.AD_PERFORMANCE);
        lock.lock();
        try {
            return runAdPerformance(records, mode);
        } finally {
            lock.unlock();
        }
    }

    public MergeResult mergeOrders(Collection<RawRecord> records, MergeMode mode) {
        ReentrantLock lock = store.mergeLock(SourceEntityType.ORDER);
        lock.lock();
        try {
            return runOrders(records, mode);
        } finally {
            lock.unlock();
        }
    }

    private MergeResult runAdPerformance(Collection<RawRecord> records, MergeMode mode) {
        FactTable<CampaignPerformanceFact> campaigns = store.campaignPerformance();
        long watermark = watermark(campaigns);
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

        List<RawRecord> selected = select(records, watermark, mode);
        Map<String, StagedAdRow> latestByKey = new LinkedHashMap<>();
        for (RawRecord record : selected) {
            Extraction<StagedAdRow> extraction = adExtractor.extract(catalog.find(record.sourceName), record);
            if (extraction.isDropped()) {
                countDrop(dropped, extraction, record);
                continue;
            }
            StagedAdRow row = extraction.row();
            latestByKey.merge(row.stagingKey(), row, FactMerger::latestStaged);
        }

        store.stagingAds().upsertAll(latestByKey.values(), FactMerger::latestStaged);

        Set<String> touchedCampaignKeys = new HashSet<>();
        Set<String> touchedStagingKeys = new HashSet<>(latestByKey.keySet());
        List<StagedAdRow> staging = store.stagingAds().snapshot();
        if (mode == MergeMode.FULL_REFRESH) {
            for (StagedAdRow row : staging) {
                touchedCampaignKeys.add(row.campaignDateKey());
                touchedStagingKeys.add(row.stagingKey());
            }
        } else {
            for (StagedAdRow row : latestByKey.values()) {
                touchedCampaignKeys.add(row.campaignDateKey());
            }
        }

        Map<String, List<StagedAdRow>> groups = new HashMap<>();
        List<AdSpendFact> adSpendBatch = new ArrayList<>();
        for (StagedAdRow row : staging) {
            String campaignKey = row.campaignDateKey();
            if (touchedCampaignKeys.contains(campaignKey)) {
                groups.computeIfAbsent(campaignKey, k -> new ArrayList<>()).add(row);
            }
            if (touchedStagingKeys.contains(row.stagingKey())) {
                adSpendBatch.add(AdSpendFacts.fromStaged(row));
            }
        }
        List<CampaignPerformanceFact> campaignBatch = new ArrayList<>(groups.size());
        for (List<StagedAdRow> group : groups.values()) {
            campaignBatch.add(CampaignPerformanceAggregator.aggregate(group));
        }

        FactTable.UpsertCounts counts = campaigns.upsertAll(campaignBatch, FactMerger::mergeCampaign);
        store.adSpend().upsertAll(adSpendBatch, FactMerger::mergeAdSpend);

        long watermarkAfter = campaigns.maxIngestedAt();
        watermarks.put(FactStore.CAMPAIGN_PERFORMANCE, watermarkAfter);
        watermarks.put(FactStore.AD_SPEND, store.adSpend().maxIngestedAt());

        MergeResult result = new MergeResult(
                SourceEntityType.AD_PERFORMANCE,
                mode,
                watermark,
                watermarkAfter,
                records.size(),
                selected.size(),
                latestByKey.size(),
                dropped,
                counts.inserted(),
                counts.updated());
        LOG.info("Ad performance merge complete: {}", result);
        return result;
    }

    private MergeResult runOrders(Collection<RawRecord> records, MergeMode mode) {
        FactTable<OrderFact> orders = store.orders();
        long watermark = watermark(orders);
        Map<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

        List<RawRecord> selected = select(records, watermark, mode);
        Map<String, OrderFact> latestById = new LinkedHashMap<>();
        for (RawRecord record : selected) {
            Extraction<OrderFact> extraction = orderExtractor.extract(catalog.find(record.sourceName), record);
            if (extraction.isDropped()) {
                countDrop(dropped, extraction, record);
                continue;
            }
            OrderFact order = extraction.row();
            latestById.merge(order.id, order, FactMerger::mergeOrder);
        }

        FactTable.UpsertCounts counts = orders.upsertAll(latestById.values(), FactMerger::mergeOrder);
        long watermarkAfter = orders.maxIngestedAt();
        watermarks.put(FactStore.ORDERS, watermarkAfter);

        MergeResult result = new MergeResult(
                SourceEntityType.ORDER,
                mode,
                watermark,
                watermarkAfter,
                records.size(),
                selected.size(),
                latestById.size(),
                dropped,
                counts.inserted(),
                counts.updated());
        LOG.info("Order merge complete: {}", result);
        return result;
    }

    private long watermark(FactTable<?> table) {
        return watermarks.get(table.name()).orElseGet(table::maxIngestedAt);
    }

    private List<RawRecord> select(Collection<RawRecord> records, long watermark, MergeMode mode) {
        if (mode == MergeMode.FULL_REFRESH) {
            return new ArrayList<>(records);
        }
        List<RawRecord> selected = new ArrayList<>();
        for (RawRecord record : records) {
            long lookbackMillis = Duration.ofDays(config.lookbackDays(record.sourceName)).toMillis();
            if (record.emittedAtMillis > watermark - lookbackMillis) {
                selected.add(record);
            }
        }
        return selected;
    }

    private static void countDrop(Map<DropReason, Integer> dropped, Extraction<?> extraction, RawRecord record) {
        dropped.merge(extraction.dropReason(), 1, Integer::sum);
        LOG.debug("Dropped record (ingestionId={}, source={}, reason={}, detail={})",
                record.ingestionId, record.sourceName, extraction.dropReason().code(), extraction.detail());
    }
}
