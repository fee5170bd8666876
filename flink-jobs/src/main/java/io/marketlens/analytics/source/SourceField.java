package io.marketlens.analytics.source;

import java.util.HashMap;
import java.util.Map;

/**
 * Canonical field names a source definition may map to raw payload paths.
 */
public enum SourceField {
    ACCOUNT_ID("account_id"),
    CAMPAIGN_ID("campaign_id"),
    AD_GROUP_ID("ad_group_id"),
    AD_ID("ad_id"),
    REPORT_DATE("report_date"),
    SPEND("spend"),
    SPEND_MICROS("spend_micros"),
    IMPRESSIONS("impressions"),
    CLICKS("clicks"),
    CONVERSIONS("conversions"),
    CONVERSION_VALUE("conversion_value"),
    CONVERSION_VALUE_MICROS("conversion_value_micros"),
    PLATFORM_ROAS("platform_roas"),
    CURRENCY("currency"),
    CAMPAIGN_NAME("campaign_name"),
    AD_GROUP_NAME("ad_group_name"),
    CHANNEL("channel"),

    ORDER_ID("order_id"),
    ORDER_NAME("order_name"),
    ORDER_NUMBER("order_number"),
    CREATED_AT("created_at"),
    UPDATED_AT("updated_at"),
    CANCELLED_AT("cancelled_at"),
    CLOSED_AT("closed_at"),
    TOTAL_PRICE("total_price"),
    TOTAL_TAX("total_tax"),
    TOTAL_DISCOUNTS("total_discounts"),
    FINANCIAL_STATUS("financial_status"),
    FULFILLMENT_STATUS("fulfillment_status"),
    CUSTOMER_ID("customer_id"),
    SHOP_ID("shop_id"),
    LANDING_SITE("landing_site");

    private static final Map<String, SourceField> BY_KEY = new HashMap<>();

    static {
        for (SourceField field : values()) {
            BY_KEY.put(field.key, field);
        }
    }

    private final String key;

    SourceField(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static SourceField fromKey(String key) {
        return BY_KEY.get(key);
    }
}
