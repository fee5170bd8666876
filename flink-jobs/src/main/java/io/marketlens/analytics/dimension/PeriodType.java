package io.marketlens.analytics.dimension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Reporting period families. Calendar periods are anchored on the period containing a date;
 * rolling periods end on the date itself.
 */
public enum PeriodType {
    DAILY("daily", "day_over_day", 0),
    WEEKLY("weekly", "week_over_week", 0),
    MONTHLY("monthly", "month_over_month", 0),
    QUARTERLY("quarterly", "quarter_over_quarter", 0),
    YEARLY("yearly", "year_over_year", 0),
    LAST_7_DAYS("last_7_days", "prior_7_days", 7),
    LAST_30_DAYS("last_30_days", "prior_30_days", 30),
    LAST_90_DAYS("last_90_days", "prior_90_days", 90);

    private final String value;
    private final String comparisonType;
    private final int rollingDays;

    PeriodType(String value, String comparisonType, int rollingDays) {
        this.value = value;
        this.comparisonType = comparisonType;
        this.rollingDays = rollingDays;
    }

    public String value() {
        return value;
    }

    public String comparisonType() {
        return comparisonType;
    }

    public boolean isRolling() {
        return rollingDays > 0;
    }

    /** First day of the period that contains or ends on {@code date}. */
    LocalDate periodStart(LocalDate date) {
        switch (this) {
            case DAILY:
                return date;
            case WEEKLY:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTHLY:
                return date.withDayOfMonth(1);
            case QUARTERLY:
                return date.withMonth(((date.getMonthValue() - 1) / 3) * 3 + 1).withDayOfMonth(1);
            case YEARLY:
                return date.withDayOfYear(1);
            default:
                return date.minusDays(rollingDays - 1L);
        }
    }

    LocalDate periodEnd(LocalDate periodStart) {
        switch (this) {
            case DAILY:
                return periodStart;
            case WEEKLY:
                return periodStart.plusDays(6);
            case MONTHLY:
                return periodStart.plusMonths(1).minusDays(1);
            case QUARTERLY:
                return periodStart.plusMonths(3).minusDays(1);
            case YEARLY:
                return periodStart.plusYears(1).minusDays(1);
            default:
                return periodStart.plusDays(rollingDays - 1L);
        }
    }

    /** First day of the comparison period; it always ends the day before {@code periodStart}. */
    LocalDate priorPeriodStart(LocalDate periodStart) {
        switch (this) {
            case DAILY:
                return periodStart.minusDays(1);
            case WEEKLY:
                return periodStart.minusDays(7);
            case MONTHLY:
                return periodStart.minusMonths(1);
            case QUARTERLY:
                return periodStart.minusMonths(3);
            case YEARLY:
                return periodStart.minusYears(1);
            default:
                return periodStart.minusDays(rollingDays);
        }
    }
}
