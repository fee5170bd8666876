package io.marketlens.analytics.reconcile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Compares fact-table totals with staging totals inside the fact table's [min_date, max_date].
 *
 * <p>{@code pct_diff = |staging - fact| / |staging| * 100}. Both totals zero is a 0% difference;
 * a zero staging total against a non-zero fact total is 100%.</p>
 */
public class ReconciliationChecker {
    private static final Logger LOG = LoggerFactory.getLogger(ReconciliationChecker.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100L);
    private static final int PCT_SCALE = 4;

    public static final double DEFAULT_TOLERANCE_PCT = 1.0;

    private final BigDecimal tolerancePct;

    public ReconciliationChecker() {
        this(DEFAULT_TOLERANCE_PCT);
    }

    public ReconciliationChecker(double tolerancePct) {
        if (tolerancePct < 0 || Double.isNaN(tolerancePct)) {
            throw new IllegalArgumentException("tolerancePct must be >= 0, was " + tolerancePct);
        }
        this.tolerancePct = BigDecimal.valueOf(tolerancePct);
    }

    public <S, F> ReconciliationResult run(ReconciliationCheck<S, F> check, Collection<S> staging, Collection<F> facts) {
        LocalDate minDate = null;
        LocalDate maxDate = null;
        for (F fact : facts) {
            LocalDate date = check.factDate().apply(fact);
            if (date == null) {
                continue;
            }
            minDate = minDate == null || date.isBefore(minDate) ? date : minDate;
            maxDate = maxDate == null || date.isAfter(maxDate) ? date : maxDate;
        }

        List<S> stagingInRange = new ArrayList<>();
        if (minDate != null) {
            for (S row : staging) {
                LocalDate date = check.stagingDate().apply(row);
                if (date != null && !date.isBefore(minDate) && !date.isAfter(maxDate)
                        && check.stagingFilter().test(row)) {
                    stagingInRange.add(row);
                }
            }
        }

        List<MetricComparison> comparisons = new ArrayList<>();
        for (ReconciliationCheck.Metric<S, F> metric : check.metrics()) {
            BigDecimal stagingTotal = BigDecimal.ZERO;
            for (S row : stagingInRange) {
                stagingTotal = stagingTotal.add(orZero(metric.staging.apply(row)));
            }
            BigDecimal factTotal = BigDecimal.ZERO;
            for (F fact : facts) {
                factTotal = factTotal.add(orZero(metric.fact.apply(fact)));
            }
            BigDecimal absDiff = stagingTotal.subtract(factTotal).abs();
            comparisons.add(new MetricComparison(
                    metric.name,
                    stagingTotal,
                    factTotal,
                    absDiff,
                    pctDiff(stagingTotal, factTotal, absDiff),
                    stagingInRange.size(),
                    facts.size(),
                    tolerancePct));
        }

        ReconciliationResult result = new ReconciliationResult(check.name(), minDate, maxDate, comparisons);
        if (result.passed()) {
            LOG.info("Reconciliation {} passed [{}..{}]", check.name(), minDate, maxDate);
        } else {
            LOG.warn("Reconciliation {} drifted [{}..{}]: {}", check.name(), minDate, maxDate, result.failures());
        }
        return result;
    }

    static BigDecimal pctDiff(BigDecimal stagingTotal, BigDecimal factTotal, BigDecimal absDiff) {
        if (stagingTotal.signum() == 0) {
            return factTotal.signum() == 0
                    ? BigDecimal.ZERO.setScale(PCT_SCALE)
                    : HUNDRED.setScale(PCT_SCALE);
        }
        return absDiff.multiply(HUNDRED).divide(stagingTotal.abs(), PCT_SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
