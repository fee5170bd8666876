package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Rolls the staging rows of one campaign-date key up into a campaign performance fact.
 *
 * <p>Additive metrics are summed over every row. Descriptive attributes come from the latest
 * emission, falling back to the newest non-null value when the latest row lacks one.</p>
 */
public final class CampaignPerformanceAggregator {
    private CampaignPerformanceAggregator() {}

    public static CampaignPerformanceFact aggregate(Collection<StagedAdRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty campaign-date group");
        }
        List<StagedAdRow> ordered = new ArrayList<>(rows);
        ordered.sort(FactMerger.EMISSION_ORDER);
        StagedAdRow latest = ordered.get(ordered.size() - 1);

        CampaignPerformanceFact fact = new CampaignPerformanceFact();
        fact.tenantId = latest.tenantId;
        fact.platform = latest.platform;
        fact.campaignId = latest.platformCampaignId;
        fact.performanceDate = latest.reportDate;
        fact.id = CampaignPerformanceFact.surrogateKey(fact.tenantId, fact.platform, fact.campaignId, fact.performanceDate);

        fact.adAccountId = latest.platformAccountId;
        fact.internalAccountId = latest.internalAccountId;
        fact.internalCampaignId = latest.internalCampaignId;
        fact.campaignName = newest(ordered, row -> row.campaignName);
        fact.canonicalChannel = newest(ordered, row -> row.canonicalChannel);
        fact.currency = newest(ordered, row -> row.currency);

        BigDecimal spend = BigDecimal.ZERO;
        BigDecimal conversions = BigDecimal.ZERO;
        BigDecimal conversionValue = BigDecimal.ZERO;
        long impressions = 0L;
        long clicks = 0L;
        long ingestedAt = 0L;
        for (StagedAdRow row : ordered) {
            if (!fact.id.equals(row.campaignDateKey())) {
                throw new IllegalArgumentException("Row " + row.ingestionId + " belongs to another campaign-date key");
            }
            spend = spend.add(row.spend);
            conversions = conversions.add(row.conversions);
            conversionValue = conversionValue.add(row.conversionValue);
            impressions += row.impressions;
            clicks += row.clicks;
            ingestedAt = Math.max(ingestedAt, row.emittedAtMillis);
        }
        fact.spend = spend;
        fact.conversions = conversions;
        fact.conversionValue = conversionValue;
        fact.impressions = impressions;
        fact.clicks = clicks;
        fact.ingestedAtMillis = ingestedAt;
        DerivedMetrics.apply(fact);
        return fact;
    }

    private static String newest(List<StagedAdRow> ordered, Function<StagedAdRow, String> attribute) {
        for (int i = ordered.size() - 1; i >= 0; i--) {
            String value = attribute.apply(ordered.get(i));
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
