package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.OrderFact;
import io.marketlens.analytics.model.StagedAdRow;
import io.marketlens.analytics.source.SourceEntityType;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The staging table and the canonical fact tables the merge engine maintains.
 */
public class FactStore {
    public static final String STAGING_ADS = "stg_ads_daily";
    public static final String CAMPAIGN_PERFORMANCE = "fact_campaign_performance";
    public static final String AD_SPEND = "fact_ad_spend";
    public static final String ORDERS = "fact_orders";

    private final FactTable<StagedAdRow> stagingAds = new FactTable<>(
            STAGING_ADS, StagedAdRow::stagingKey, row -> row.tenantId, row -> row.emittedAtMillis);
    private final FactTable<CampaignPerformanceFact> campaignPerformance = new FactTable<>(
            CAMPAIGN_PERFORMANCE, fact -> fact.id, fact -> fact.tenantId, fact -> fact.ingestedAtMillis);
    private final FactTable<AdSpendFact> adSpend = new FactTable<>(
            AD_SPEND, fact -> fact.id, fact -> fact.tenantId, fact -> fact.ingestedAtMillis);
    private final FactTable<OrderFact> orders = new FactTable<>(
            ORDERS, fact -> fact.id, fact -> fact.tenantId, fact -> fact.ingestedAtMillis);
    private final Map<SourceEntityType, ReentrantLock> mergeLocks = new EnumMap<>(SourceEntityType.class);

    public FactStore() {
        for (SourceEntityType type : SourceEntityType.values()) {
            mergeLocks.put(type, new ReentrantLock());
        }
    }

    public FactTable<StagedAdRow> stagingAds() {
        return stagingAds;
    }

    public FactTable<CampaignPerformanceFact> campaignPerformance() {
        return campaignPerformance;
    }

    public FactTable<AdSpendFact> adSpend() {
        return adSpend;
    }

    public FactTable<OrderFact> orders() {
        return orders;
    }

    /**
     * Held for a whole merge run of one entity type, from staging read to watermark update.
     */
    public ReentrantLock mergeLock(SourceEntityType type) {
        return mergeLocks.get(type);
    }
}
