package io.marketlens.analytics.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical ad-grain spend row; the surrogate key is the staging row's natural-key hash.
 */
public class AdSpendFact implements Serializable {
    private static final long serialVersionUID = 1L;

    public String id;
    public String tenantId;
    public String platform;

    public String adAccountId;
    public String campaignId;
    public String adGroupId;
    public String adId;
    public String internalAccountId;
    public String internalCampaignId;
    public String internalAdGroupId;
    public String internalAdId;

    public LocalDate spendDate;
    public BigDecimal spend = BigDecimal.ZERO;
    public String currency;
    public String canonicalChannel;

    public long impressions;
    public long clicks;
    public BigDecimal conversions = BigDecimal.ZERO;
    public BigDecimal conversionValue = BigDecimal.ZERO;
    public BigDecimal cpm;
    public BigDecimal ctr;
    public BigDecimal cpc;
    public BigDecimal cpa;
    public BigDecimal roasPlatform;

    public long ingestedAtMillis;

    public AdSpendFact() {}
}
