package io.marketlens.analytics.merge;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class DerivedMetricsTest {

    @Test
    void ratiosAreRoundedToTheirScales() {
        BigDecimal spend = new BigDecimal("100");

        assertEquals(new BigDecimal("33.33"), DerivedMetrics.cpm(spend, 3000L));
        assertEquals(new BigDecimal("3.3333"), DerivedMetrics.ctr(1L, 30L));
        assertEquals(new BigDecimal("14.29"), DerivedMetrics.cpc(spend, 7L));
        assertEquals(new BigDecimal("33.33"), DerivedMetrics.cpa(spend, new BigDecimal("3")));
        assertEquals(new BigDecimal("2.5000"), DerivedMetrics.roas(new BigDecimal("250"), spend));
    }

    @Test
    void zeroDenominatorYieldsNull() {
        assertNull(DerivedMetrics.cpm(BigDecimal.TEN, 0L));
        assertNull(DerivedMetrics.ctr(5L, 0L));
        assertNull(DerivedMetrics.cpc(BigDecimal.TEN, 0L));
        assertNull(DerivedMetrics.cpa(BigDecimal.TEN, BigDecimal.ZERO));
        assertNull(DerivedMetrics.roas(BigDecimal.TEN, BigDecimal.ZERO));
    }
}
