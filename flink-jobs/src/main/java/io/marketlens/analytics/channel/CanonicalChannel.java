package io.marketlens.analytics.channel;

import java.util.Locale;

/**
 * Platform-independent marketing channel taxonomy.
 */
public enum CanonicalChannel {
    PAID_SOCIAL,
    PAID_SEARCH,
    DISPLAY,
    VIDEO,
    SHOPPING,
    EMAIL,
    ORGANIC_SOCIAL,
    ORGANIC_SEARCH,
    DIRECT,
    REFERRAL,
    AFFILIATE,
    SMS,
    PUSH,
    MARKETPLACE,
    OTHER;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
