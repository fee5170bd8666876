package io.marketlens.analytics.model;

import io.marketlens.analytics.util.Hashing;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Generated reporting period with symmetric prior-period bounds for period-over-period comparison.
 */
public final class DateRange implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String periodType;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final LocalDate priorPeriodStart;
    private final LocalDate priorPeriodEnd;
    private final String comparisonType;

    public DateRange(
            String periodType,
            LocalDate periodStart,
            LocalDate periodEnd,
            LocalDate priorPeriodStart,
            LocalDate priorPeriodEnd,
            String comparisonType) {
        this.periodType = periodType;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.priorPeriodStart = priorPeriodStart;
        this.priorPeriodEnd = priorPeriodEnd;
        this.comparisonType = comparisonType;
    }

    public String id() {
        return Hashing.md5OfParts(periodType, periodStart.toString(), periodEnd.toString());
    }

    public String periodType() {
        return periodType;
    }

    public LocalDate periodStart() {
        return periodStart;
    }

    public LocalDate periodEnd() {
        return periodEnd;
    }

    public LocalDate priorPeriodStart() {
        return priorPeriodStart;
    }

    public LocalDate priorPeriodEnd() {
        return priorPeriodEnd;
    }

    public String comparisonType() {
        return comparisonType;
    }

    public long periodDays() {
        return ChronoUnit.DAYS.between(periodStart, periodEnd) + 1;
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(periodStart) && !date.isAfter(periodEnd);
    }

    @Override
    public String toString() {
        return periodType + "[" + periodStart + ".." + periodEnd + "]";
    }
}
