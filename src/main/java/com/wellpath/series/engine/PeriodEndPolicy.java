package com.wellpath.series.engine;

import com.wellpath.series.model.Granularity;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Supplies a period end when none of a bucket's records carries one.
 */
@FunctionalInterface
public interface PeriodEndPolicy {

    Instant periodEnd(Instant periodStart);

    /**
     * Calendar default: same day for daily periods, start + 6 days for weekly,
     * last day of the month for monthly. Ends are midnight of that last day in {@code zone}.
     */
    static PeriodEndPolicy calendar(Granularity granularity, ZoneId zone) {
        return periodStart -> granularity.lastDay(periodStart.atZone(zone).toLocalDate())
                .atStartOfDay(zone)
                .toInstant();
    }
}
