package io.marketlens.analytics.model;

import io.marketlens.analytics.util.Hashing;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Canonical order row. Finalized attributes are kept once set; status timestamps may still move.
 */
public class OrderFact implements Serializable {
    private static final long serialVersionUID = 1L;

    public String id;
    public String tenantId;
    public String sourcePlatform;

    public String orderId;
    public String orderName;
    public Long orderNumber;
    public String customerKey;
    public String platformAccountId;
    public String internalAccountId;

    public LocalDate orderDate;
    public Instant createdAt;
    public Instant updatedAt;
    public Instant cancelledAt;
    public Instant closedAt;

    public BigDecimal revenueGross = BigDecimal.ZERO;
    public BigDecimal revenueNet = BigDecimal.ZERO;
    public BigDecimal totalTax = BigDecimal.ZERO;
    public BigDecimal totalDiscounts = BigDecimal.ZERO;
    public String currency;

    public String financialStatus;
    public String fulfillmentStatus;
    public boolean validOrder;

    public String platformChannel;
    public String canonicalChannel;

    public String utmSource;
    public String utmMedium;
    public String utmCampaign;
    public String utmTerm;
    public String utmContent;

    public long ingestedAtMillis;

    public OrderFact() {}

    public static String surrogateKey(String tenantId, String orderId, String platformAccountId) {
        return Hashing.md5OfParts(tenantId, orderId, platformAccountId);
    }

    public OrderFact copy() {
        OrderFact c = new OrderFact();
        c.id = id;
        c.tenantId = tenantId;
        c.sourcePlatform = sourcePlatform;
        c.orderId = orderId;
        c.orderName = orderName;
        c.orderNumber = orderNumber;
        c.customerKey = customerKey;
        c.platformAccountId = platformAccountId;
        c.internalAccountId = internalAccountId;
        c.orderDate = orderDate;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.cancelledAt = cancelledAt;
        c.closedAt = closedAt;
        c.revenueGross = revenueGross;
        c.revenueNet = revenueNet;
        c.totalTax = totalTax;
        c.totalDiscounts = totalDiscounts;
        c.currency = currency;
        c.financialStatus = financialStatus;
        c.fulfillmentStatus = fulfillmentStatus;
        c.validOrder = validOrder;
        c.platformChannel = platformChannel;
        c.canonicalChannel = canonicalChannel;
        c.utmSource = utmSource;
        c.utmMedium = utmMedium;
        c.utmCampaign = utmCampaign;
        c.utmTerm = utmTerm;
        c.utmContent = utmContent;
        c.ingestedAtMillis = ingestedAtMillis;
        return c;
    }

    public boolean isFinalized() {
        return cancelledAt != null || closedAt != null;
    }
}
