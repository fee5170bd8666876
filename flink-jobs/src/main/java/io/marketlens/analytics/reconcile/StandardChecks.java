package io.marketlens.analytics.reconcile;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.util.function.Predicate;

/**
 * Reconciliation checks for the ad fact tables against the ad staging table.
 */
public final class StandardChecks {
    // Same required keys the fact build enforces.
    private static final Predicate<StagedAdRow> FACT_FILTER = row -> row.tenantId != null
            && row.platformAccountId != null
            && row.platformCampaignId != null
            && row.reportDate != null
            && row.spend != null;

    private StandardChecks() {}

    public static ReconciliationCheck<StagedAdRow, CampaignPerformanceFact> campaignPerformance() {
        return ReconciliationCheck.<StagedAdRow, CampaignPerformanceFact>builder("fact_campaign_performance")
                .dates(row -> row.reportDate, fact -> fact.performanceDate)
                .stagingFilter(FACT_FILTER)
                .metric("spend", row -> row.spend, fact -> fact.spend)
                .metric("conversion_value", row -> row.conversionValue, fact -> fact.conversionValue)
                .metric("conversions", row -> row.conversions, fact -> fact.conversions)
                .build();
    }

    public static ReconciliationCheck<StagedAdRow, AdSpendFact> adSpend() {
        return ReconciliationCheck.<StagedAdRow, AdSpendFact>builder("fact_ad_spend")
                .dates(row -> row.reportDate, fact -> fact.spendDate)
                .stagingFilter(FACT_FILTER)
                .metric("spend", row -> row.spend, fact -> fact.spend)
                .metric("impressions", row -> BigDecimal.valueOf(row.impressions), fact -> BigDecimal.valueOf(fact.impressions))
                .metric("clicks", row -> BigDecimal.valueOf(row.clicks), fact -> BigDecimal.valueOf(fact.clicks))
                .build();
    }
}
