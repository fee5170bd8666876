package io.marketlens.analytics.model;

import io.marketlens.analytics.util.Hashing;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Ad-platform row after extraction, type casting, tenant resolution and channel classification.
 *
 * <p>Staging keeps one row per {@link #stagingKey()}: the latest emission wins.</p>
 */
public class StagedAdRow implements Serializable {
    private static final long serialVersionUID = 1L;

    public String tenantId;
    public String platform;
    public LocalDate reportDate;

    public String platformAccountId;
    public String platformCampaignId;
    public String platformAdGroupId;
    public String platformAdId;

    public String internalAccountId;
    public String internalCampaignId;
    public String internalAdGroupId;
    public String internalAdId;

    public String platformChannel;
    public String canonicalChannel;

    public BigDecimal spend = BigDecimal.ZERO;
    public long impressions;
    public long clicks;
    public BigDecimal conversions = BigDecimal.ZERO;
    public BigDecimal conversionValue = BigDecimal.ZERO;
    public BigDecimal platformRoasReported;
    public String currency;

    public String campaignName;
    public String adGroupName;

    public String ingestionId;
    public long emittedAtMillis;

    public StagedAdRow() {}

    /**
     * Natural key at ad grain: tenant, platform, account, campaign, ad group, ad, date.
     */
    public String stagingKey() {
        return Hashing.md5OfParts(
                tenantId,
                platform,
                platformAccountId,
                platformCampaignId,
                platformAdGroupId,
                platformAdId,
                reportDate == null ? null : reportDate.toString());
    }

    /**
     * Natural key at campaign-date grain, matching the campaign performance surrogate key.
     */
    public String campaignDateKey() {
        return CampaignPerformanceFact.surrogateKey(tenantId, platform, platformCampaignId, reportDate);
    }
}
