package com.wellpath.series.engine;

import com.wellpath.series.model.DateWindow;
import com.wellpath.series.model.Granularity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Computes period-aligned look-back/look-ahead windows.
 *
 * <p>The reference instant is first truncated to the start of its own period, then the
 * window is extended by whole periods in both directions. Both bounds are period starts,
 * so {@link DateWindow#contains(Instant)} can be checked directly against period keys.
 */
public class CalendarWindow {

    private static final Logger log = LoggerFactory.getLogger(CalendarWindow.class);

    public DateWindow computeWindow(Instant reference, Granularity granularity, int unitsBack, int unitsAhead) {
        return computeWindow(reference, granularity, unitsBack, unitsAhead, ZoneOffset.UTC, DayOfWeek.MONDAY);
    }

    /**
     * @param reference   Instant whose period anchors the window
     * @param granularity Period size
     * @param unitsBack   Whole periods before the reference period
     * @param unitsAhead  Whole periods after the reference period
     * @param zone        Zone the calendar is evaluated in
     * @param weekStart   First day of week for weekly periods
     * @return Inclusive window of period starts
     * @throws InvalidRangeException if the dates fall outside the representable range
     */
    public DateWindow computeWindow(Instant reference, Granularity granularity, int unitsBack, int unitsAhead,
                                    ZoneId zone, DayOfWeek weekStart) {
        if (unitsBack < 0 || unitsAhead < 0) {
            throw new IllegalArgumentException("unitsBack and unitsAhead must be non-negative");
        }
        try {
            LocalDate anchor = granularity.periodStart(reference.atZone(zone).toLocalDate(), weekStart);
            LocalDate start = granularity.plusUnits(anchor, -(long) unitsBack);
            LocalDate end = granularity.plusUnits(anchor, unitsAhead);
            DateWindow window = new DateWindow(start.atStartOfDay(zone).toInstant(), end.atStartOfDay(zone).toInstant());
            log.debug("Window for {} {} back={} ahead={}: {} to {}",
                    reference, granularity.getLabel(), unitsBack, unitsAhead, window.start(), window.end());
            return window;
        } catch (DateTimeException | ArithmeticException e) {
            log.error("Failed to calculate date range: reference={} granularity={} back={} ahead={}",
                    reference, granularity.getLabel(), unitsBack, unitsAhead, e);
            throw new InvalidRangeException("Failed to calculate date range", e);
        }
    }

    /**
     * The period key of an instant: midnight (in {@code zone}) of the first day of its period.
     */
    public Instant periodKey(Instant instant, Granularity granularity, ZoneId zone, DayOfWeek weekStart) {
        LocalDate date = instant.atZone(zone).toLocalDate();
        return granularity.periodStart(date, weekStart).atStartOfDay(zone).toInstant();
    }
}
