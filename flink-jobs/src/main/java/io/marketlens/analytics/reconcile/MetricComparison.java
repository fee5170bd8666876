package io.marketlens.analytics.reconcile;

import java.math.BigDecimal;

/**
 * Staging versus fact totals for one metric, with the diagnostics needed for triage.
 */
public final class MetricComparison {
    private final String metric;
    private final BigDecimal stagingTotal;
    private final BigDecimal factTotal;
    private final BigDecimal absDiff;
    private final BigDecimal pctDiff;
    private final int stagingRows;
    private final int factRows;
    private final BigDecimal tolerancePct;

    public MetricComparison(
            String metric,
            BigDecimal stagingTotal,
            BigDecimal factTotal,
            BigDecimal absDiff,
            BigDecimal pctDiff,
            int stagingRows,
            int factRows,
            BigDecimal tolerancePct) {
        this.metric = metric;
        this.stagingTotal = stagingTotal;
        this.factTotal = factTotal;
        this.absDiff = absDiff;
        this.pctDiff = pctDiff;
        this.stagingRows = stagingRows;
        this.factRows = factRows;
        this.tolerancePct = tolerancePct;
    }

    public String metric() {
        return metric;
    }

    public BigDecimal stagingTotal() {
        return stagingTotal;
    }

    public BigDecimal factTotal() {
        return factTotal;
    }

    public BigDecimal absDiff() {
        return absDiff;
    }

    public BigDecimal pctDiff() {
        return pctDiff;
    }

    public int stagingRows() {
        return stagingRows;
    }

    public int factRows() {
        return factRows;
    }

    public BigDecimal tolerancePct() {
        return tolerancePct;
    }

    public boolean passed() {
        return pctDiff.compareTo(tolerancePct) <= 0;
    }

    @Override
    public String toString() {
        return metric + "{staging_total=" + stagingTotal.toPlainString()
                + ", fact_total=" + factTotal.toPlainString()
                + ", abs_diff=" + absDiff.toPlainString()
                + ", pct_diff=" + pctDiff.toPlainString()
                + ", staging_rows=" + stagingRows
                + ", fact_rows=" + factRows
                + ", tolerance_pct=" + tolerancePct.toPlainString() + "}";
    }
}
