package io.marketlens.analytics.dimension;

import io.marketlens.analytics.model.DateRange;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the date range dimension for every day of a spine.
 *
 * <p>Only complete periods are emitted: a period must start on or after the spine start and end on
 * or before {@code today}. The dimension is regenerated wholesale on each run.</p>
 */
public final class DateRangeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(DateRangeGenerator.class);

    private DateRangeGenerator() {}

    public static List<DateRange> generate(LocalDate spineStart, LocalDate today) {
        if (spineStart.isAfter(today)) {
            throw new IllegalArgumentException("Spine start " + spineStart + " is after " + today);
        }
        List<DateRange> ranges = new ArrayList<>();
        for (PeriodType type : PeriodType.values()) {
            Set<LocalDate> starts = new LinkedHashSet<>();
            for (LocalDate day = spineStart; !day.isAfter(today); day = day.plusDays(1)) {
                starts.add(type.periodStart(day));
            }
            for (LocalDate start : starts) {
                LocalDate end = type.periodEnd(start);
                if (start.isBefore(spineStart) || end.isAfter(today)) {
                    continue;
                }
                ranges.add(new DateRange(
                        type.value(),
                        start,
                        end,
                        type.priorPeriodStart(start),
                        start.minusDays(1),
                        type.comparisonType()));
            }
        }
        LOG.debug("Generated {} date ranges for [{}..{}]", ranges.size(), spineStart, today);
        return ranges;
    }
}
