package io.marketlens.analytics.model;

import io.marketlens.analytics.util.Hashing;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical campaign-date performance row across all ad platforms.
 */
public class CampaignPerformanceFact implements Serializable {
    private static final long serialVersionUID = 1L;

    public String id;
    public String tenantId;
    public String platform;

    public String adAccountId;
    public String campaignId;
    public String campaignName;
    public String internalAccountId;
    public String internalCampaignId;

    public LocalDate performanceDate;
    public String canonicalChannel;

    public BigDecimal spend = BigDecimal.ZERO;
    public long impressions;
    public long clicks;
    public BigDecimal conversions = BigDecimal.ZERO;
    public BigDecimal conversionValue = BigDecimal.ZERO;

    public BigDecimal cpm;
    public BigDecimal ctr;
    public BigDecimal cpc;
    public BigDecimal cpa;
    public BigDecimal roasPlatform;

    public String currency;
    /** Latest emission timestamp of any contributing staging row. */
    public long ingestedAtMillis;

    public CampaignPerformanceFact() {}

    public static String surrogateKey(String tenantId, String platform, String campaignId, LocalDate date) {
        return Hashing.md5OfParts(tenantId, platform, campaignId, date == null ? null : date.toString());
    }
}
