package io.marketlens.analytics.reconcile;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reconciliation check over the fact table's observed date range.
 */
public final class ReconciliationResult {
    private final String checkName;
    private final LocalDate minDate;
    private final LocalDate maxDate;
    private final List<MetricComparison> comparisons;

    public ReconciliationResult(String checkName, LocalDate minDate, LocalDate maxDate, List<MetricComparison> comparisons) {
        this.checkName = checkName;
        this.minDate = minDate;
        this.maxDate = maxDate;
        this.comparisons = List.copyOf(comparisons);
    }

    public String checkName() {
        return checkName;
    }

    /** Earliest fact date, or null when the fact table is empty. */
    public LocalDate minDate() {
        return minDate;
    }

    public LocalDate maxDate() {
        return maxDate;
    }

    public List<MetricComparison> comparisons() {
        return comparisons;
    }

    public MetricComparison comparison(String metric) {
        for (MetricComparison comparison : comparisons) {
            if (comparison.metric().equals(metric)) {
                return comparison;
            }
        }
        throw new IllegalArgumentException("No comparison for metric " + metric + " in " + checkName);
    }

    public boolean passed() {
        return failures().isEmpty();
    }

    public List<MetricComparison> failures() {
        List<MetricComparison> failures = new ArrayList<>();
        for (MetricComparison comparison : comparisons) {
            if (!comparison.passed()) {
                failures.add(comparison);
            }
        }
        return failures;
    }

    /**
     * @throws ReconciliationDriftException when any metric drifts beyond tolerance
     */
    public ReconciliationResult assertPassed() {
        if (!passed()) {
            throw new ReconciliationDriftException(this);
        }
        return this;
    }
}
