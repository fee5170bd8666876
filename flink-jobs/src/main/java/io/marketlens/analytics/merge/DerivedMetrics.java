package io.marketlens.analytics.merge;

import io.marketlens.analytics.model.AdSpendFact;
import io.marketlens.analytics.model.CampaignPerformanceFact;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Ratio metrics derived from summed base metrics. A zero denominator yields null, never zero.
 */
public final class DerivedMetrics {
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000L);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100L);

    private DerivedMetrics() {}

    /** Cost per thousand impressions, 2 dp. */
    public static BigDecimal cpm(BigDecimal spend, long impressions) {
        if (impressions <= 0) {
            return null;
        }
        return spend.multiply(THOUSAND).divide(BigDecimal.valueOf(impressions), 2, RoundingMode.HALF_UP);
    }

    /** Click-through rate as a percentage, 4 dp. */
    public static BigDecimal ctr(long clicks, long impressions) {
        if (impressions <= 0) {
            return null;
        }
        return BigDecimal.valueOf(clicks).multiply(HUNDRED)
                .divide(BigDecimal.valueOf(impressions), 4, RoundingMode.HALF_UP);
    }

    /** Cost per click, 2 dp. */
    public static BigDecimal cpc(BigDecimal spend, long clicks) {
        if (clicks <= 0) {
            return null;
        }
        return spend.divide(BigDecimal.valueOf(clicks), 2, RoundingMode.HALF_UP);
    }

    /** Cost per conversion, 2 dp. */
    public static BigDecimal cpa(BigDecimal spend, BigDecimal conversions) {
        if (conversions == null || conversions.signum() <= 0) {
            return null;
        }
        return spend.divide(conversions, 2, RoundingMode.HALF_UP);
    }

    /** Platform-reported conversion value over spend, 4 dp. */
    public static BigDecimal roas(BigDecimal conversionValue, BigDecimal spend) {
        if (spend == null || spend.signum() <= 0) {
            return null;
        }
        return conversionValue.divide(spend, 4, RoundingMode.HALF_UP);
    }

    static void apply(CampaignPerformanceFact fact) {
        fact.cpm = cpm(fact.spend, fact.impressions);
        fact.ctr = ctr(fact.clicks, fact.impressions);
        fact.cpc = cpc(fact.spend, fact.clicks);
        fact.cpa = cpa(fact.spend, fact.conversions);
        fact.roasPlatform = roas(fact.conversionValue, fact.spend);
    }

    static void apply(AdSpendFact fact) {
        fact.cpm = cpm(fact.spend, fact.impressions);
        fact.ctr = ctr(fact.clicks, fact.impressions);
        fact.cpc = cpc(fact.spend, fact.clicks);
        fact.cpa = cpa(fact.spend, fact.conversions);
        fact.roasPlatform = roas(fact.conversionValue, fact.spend);
    }
}
