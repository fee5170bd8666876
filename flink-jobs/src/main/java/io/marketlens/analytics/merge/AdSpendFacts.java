package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.StagedAdRow;

/**
 * Projects a staging row onto the ad-grain spend fact.
 */
public final class AdSpendFacts {
    private AdSpendFacts() {}

    public static AdSpendFact fromStaged(StagedAdRow row) {
        AdSpendFact fact = new AdSpendFact();
        fact.id = row.stagingKey();
        fact.tenantId = row.tenantId;
        fact.platform = row.platform;
        fact.adAccountId = row.platformAccountId;
        fact.campaignId = row.platformCampaignId;
        fact.adGroupId = row.platformAdGroupId;
        fact.adId = row.platformAdId;
        fact.internalAccountId = row.internalAccountId;
        fact.internalCampaignId = row.internalCampaignId;
        fact.internalAdGroupId = row.internalAdGroupId;
        fact.internalAdId = row.internalAdId;
        fact.spendDate = row.reportDate;
        fact.spend = row.spend;
        fact.currency = row.currency;
        fact.canonicalChannel = row.canonicalChannel;
        fact.impressions = row.impressions;
        fact.clicks = row.clicks;
        fact.conversions = row.conversions;
        fact.conversionValue = row.conversionValue;
        fact.ingestedAtMillis = row.emittedAtMillis;
        DerivedMetrics.apply(fact);
        return fact;
    }
}
