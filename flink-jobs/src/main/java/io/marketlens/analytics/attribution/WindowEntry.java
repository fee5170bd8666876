package io.marketlens.analytics.attribution;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.util.IdentifierNormalizer;

/**
 * One campaign-date row with spend inside an order's attribution window.
 */
public final class WindowEntry {
    private final CampaignPerformanceFact fact;
    private final int daysBeforeOrder;

    public WindowEntry(CampaignPerformanceFact fact, int daysBeforeOrder) {
        this.fact = fact;
        this.daysBeforeOrder = daysBeforeOrder;
    }

    public CampaignPerformanceFact fact() {
        return fact;
    }

    public int daysBeforeOrder() {
        return daysBeforeOrder;
    }

    String campaignKey() {
        return campaignKey(fact);
    }

    /**
     * Normalized campaign id ({@code cmp_...}); native ids are only unique within a platform.
     * Facts built without one get it derived from tenant, platform and native id.
     */
    static String campaignKey(CampaignPerformanceFact fact) {
        if (fact.internalCampaignId != null) {
            return fact.internalCampaignId;
        }
        return IdentifierNormalizer.campaignId(fact.tenantId, fact.platform, fact.campaignId);
    }
}
