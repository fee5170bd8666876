package io.marketlens.analytics.model;

import io.marketlens.analytics.util.Hashing;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One attribution row per (order, assigned campaign, attribution model).
 */
public class AttributionRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String STATUS_ATTRIBUTED = "attributed";
    public static final String STATUS_UNATTRIBUTED = "unattributed";
    public static final String NO_CAMPAIGN = "none";

    public String id;
    public String tenantId;
    public String orderId;
    public Instant orderCreatedAt;
    public String currency;
    public BigDecimal revenue;

    public String campaignFactId;
    public String campaignId;
    public String campaignName;
    public String platform;
    public String adAccountId;
    /** Most recent activity date of the campaign inside the window. */
    public LocalDate campaignPerformanceDate;
    public Integer daysBeforeOrder;

    public BigDecimal attributedRevenue;
    public double attributionWeight;
    public int totalCampaignsInWindow;
    /** Campaign-date rows that contributed to this order's window. */
    public int windowEntries;

    public String attributionModel;
    public String attributionStatus;

    public AttributionRecord() {}

    /**
     * Keyed on the normalized campaign id so equal native ids on different platforms stay distinct.
     */
    public static String recordId(String orderId, String campaignKey, String tenantId, String model) {
        return Hashing.md5OfParts(orderId, campaignKey == null ? NO_CAMPAIGN : campaignKey, tenantId, model);
    }
}
