package io.marketlens.analytics.parse;

/**
 * Why an extracted record was excluded from staging.
 */
public enum DropReason {
    UNKNOWN_SOURCE("unknown_source"),
    MALFORMED_PAYLOAD("malformed_payload"),
    UNRESOLVED_TENANT("unresolved_tenant"),
    MISSING_ACCOUNT("missing_account"),
    MISSING_CAMPAIGN("missing_campaign"),
    MISSING_DATE("missing_date"),
    MISSING_ORDER_ID("missing_order_id");

    private final String code;

    DropReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
