package io.marketlens.analytics.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.marketlens.analytics.attribution.AttributionEngine;
import io.marketlens.analytics.attribution.AttributionSettings;
import io.marketlens.analytics.attribution.LastClickResolver;
import io.marketlens.analytics.config.PipelineConfig;
import io.marketlens.analytics.merge.FactStore;
import io.marketlens.analytics.merge.IncrementalMergeEngine;
import io.marketlens.analytics.merge.MergeMode;
import io.marketlens.analytics.merge.MergeResult;
import io.marketlens.analytics.merge.MergeRunner;
import io.marketlens.analytics.merge.WatermarkStore;
import io.marketlens.analytics.model.AttributionRecord;
import io.marketlens.analytics.model.RawRecord;
import io.marketlens.analytics.reconcile.ReconciliationChecker;
import io.marketlens.analytics.reconcile.ReconciliationResult;
import io.marketlens.analytics.reconcile.StandardChecks;
import io.marketlens.analytics.source.SourceCatalog;
import io.marketlens.analytics.source.SourceEntityType;
import io.marketlens.analytics.tenant.TenantResolver;
import io.marketlens.analytics.util.BuildMetadata;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One incremental batch: merge every entity type, attribute orders over the merged facts, then
 * reconcile the ad fact tables against staging.
 */
public class MarketingFactsBatch implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(MarketingFactsBatch.class);

    private final FactStore store;
    private final MergeRunner mergeRunner;
    private final AttributionEngine attributionEngine;
    private final ReconciliationChecker reconciliationChecker;

    public MarketingFactsBatch(
            PipelineConfig config,
            SourceCatalog catalog,
            TenantResolver tenantResolver,
            LastClickResolver lastClickResolver,
            FactStore store,
            WatermarkStore watermarks) {
        this.store = store;
        IncrementalMergeEngine engine = new IncrementalMergeEngine(catalog, tenantResolver, config, store, watermarks);
        this.mergeRunner = new MergeRunner(engine, catalog, config.mergeParallelism);
        this.attributionEngine = new AttributionEngine(AttributionSettings.fromConfig(config), lastClickResolver);
        this.reconciliationChecker = new ReconciliationChecker(config.reconciliationTolerancePct);
    }

    public Report run(Collection<RawRecord> records, MergeMode mode) {
        Map<SourceEntityType, MergeResult> merges = mergeRunner.run(records, mode);
        List<AttributionRecord> attributions = attributionEngine.attribute(
                store.orders().snapshot(), store.campaignPerformance().snapshot());

        ReconciliationResult campaignCheck = reconciliationChecker.run(
                StandardChecks.campaignPerformance(), store.stagingAds().snapshot(), store.campaignPerformance().snapshot());
        ReconciliationResult adSpendCheck = reconciliationChecker.run(
                StandardChecks.adSpend(), store.stagingAds().snapshot(), store.adSpend().snapshot());

        Report report = new Report(BuildMetadata.current().identity(), merges, attributions,
                List.of(campaignCheck, adSpendCheck));
        LOG.info("Batch complete (build={}, mode={}, attributionRecords={}, reconciliationPassed={})",
                report.buildIdentity(), mode, attributions.size(), report.reconciliationPassed());
        return report;
    }

    @Override
    public void close() {
        mergeRunner.close();
    }

    /**
     * Merge counters, attribution output and reconciliation outcomes of one batch.
     */
    public static final class Report {
        private final String buildIdentity;
        private final Map<SourceEntityType, MergeResult> merges;
        private final List<AttributionRecord> attributions;
        private final List<ReconciliationResult> reconciliations;

        Report(String buildIdentity,
               Map<SourceEntityType, MergeResult> merges,
               List<AttributionRecord> attributions,
               List<ReconciliationResult> reconciliations) {
            this.buildIdentity = buildIdentity;
            this.merges = merges;
            this.attributions = attributions;
            this.reconciliations = reconciliations;
        }

        public String buildIdentity() {
            return buildIdentity;
        }

        public MergeResult merge(SourceEntityType type) {
            return merges.get(type);
        }

        public List<AttributionRecord> attributions() {
            return attributions;
        }

        public List<ReconciliationResult> reconciliations() {
            return reconciliations;
        }

        public boolean reconciliationPassed() {
            for (ReconciliationResult result : reconciliations) {
                if (!result.passed()) {
                    return false;
                }
            }
            return true;
        }
    }
}
