package io.marketlens.analytics.reconcile;

import org.junit.jupiter.api.Test;

import io.marketlens.analytics.model.CampaignPerformanceFact;
import io.marketlens.analytics.model.StagedAdRow;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationCheckerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 5);

    private final ReconciliationChecker checker = new ReconciliationChecker();

    @Test
    void matchingTotalsPassWithZeroDifference() {
        ReconciliationResult result = checker.run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "60"), staged(DAY, "40")),
                List.of(fact(DAY, "100")));

        assertTrue(result.passed());
        MetricComparison spend = result.comparison("spend");
        assertEquals(0, BigDecimal.ZERO.compareTo(spend.pctDiff()));
        assertEquals(2, spend.stagingRows());
        assertEquals(1, spend.factRows());
        assertSame(result, result.assertPassed());
    }

    @Test
    void driftAboveToleranceFailsWithDiagnostics() {
        ReconciliationResult result = checker.run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "100")),
                List.of(fact(DAY, "95")));

        assertFalse(result.passed());
        MetricComparison spend = result.comparison("spend");
        assertEquals(0, new BigDecimal("100").compareTo(spend.stagingTotal()));
        assertEquals(0, new BigDecimal("95").compareTo(spend.factTotal()));
        assertEquals(0, new BigDecimal("5").compareTo(spend.absDiff()));
        assertEquals(0, new BigDecimal("5.0000").compareTo(spend.pctDiff()));
        assertEquals(0, new BigDecimal("1.0").compareTo(spend.tolerancePct()));
        assertEquals(1, result.failures().size());

        ReconciliationDriftException ex = assertThrows(ReconciliationDriftException.class, result::assertPassed);
        assertSame(result, ex.result());
    }

    @Test
    void driftWithinToleranceStillPasses() {
        ReconciliationResult result = checker.run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "1000")),
                List.of(fact(DAY, "995")));

        assertTrue(result.passed());
        assertEquals(0, new BigDecimal("0.5000").compareTo(result.comparison("spend").pctDiff()));
    }

    @Test
    void stagingOutsideFactDateRangeIsIgnored() {
        ReconciliationResult result = checker.run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "100"), staged(DAY.minusDays(1), "500"), staged(DAY.plusDays(1), "500")),
                List.of(fact(DAY, "100")));

        assertTrue(result.passed());
        assertEquals(DAY, result.minDate());
        assertEquals(DAY, result.maxDate());
        assertEquals(1, result.comparison("spend").stagingRows());
    }

    @Test
    void zeroTotalsAreHandled() {
        assertEquals(0, BigDecimal.ZERO.compareTo(
                ReconciliationChecker.pctDiff(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO)));
        assertEquals(0, new BigDecimal("100").compareTo(
                ReconciliationChecker.pctDiff(BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.TEN)));

        ReconciliationResult empty = checker.run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "100")), List.of());
        assertTrue(empty.passed());
        assertEquals(0, empty.comparison("spend").stagingRows());
    }

    @Test
    void customToleranceIsApplied() {
        ReconciliationResult result = new ReconciliationChecker(10.0).run(StandardChecks.campaignPerformance(),
                List.of(staged(DAY, "100")),
                List.of(fact(DAY, "95")));

        assertTrue(result.passed());
        assertThrows(IllegalArgumentException.class, () -> new ReconciliationChecker(-1.0));
    }

    private static StagedAdRow staged(LocalDate date, String spend) {
        StagedAdRow row = new StagedAdRow();
        row.tenantId = "tenant-a";
        row.platform = "meta_ads";
        row.platformAccountId = "act_1";
        row.platformCampaignId = "c1";
        row.reportDate = date;
        row.spend = new BigDecimal(spend);
        return row;
    }

    private static CampaignPerformanceFact fact(LocalDate date, String spend) {
        CampaignPerformanceFact fact = new CampaignPerformanceFact();
        fact.tenantId = "tenant-a";
        fact.platform = "meta_ads";
        fact.campaignId = "c1";
        fact.performanceDate = date;
        fact.spend = new BigDecimal(spend);
        return fact;
    }
}
