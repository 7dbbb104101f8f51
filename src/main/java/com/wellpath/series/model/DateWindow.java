package com.wellpath.series.model;

import java.time.Instant;

/**
 * Inclusive window of period-start instants.
 *
 * @param start First period start in the window
 * @param end   Last period start in the window
 */
public record DateWindow(Instant start, Instant end) {

    public DateWindow {
        if (start == null || end == null) throw new IllegalArgumentException("Window bounds must not be null");
        if (start.isAfter(end)) throw new IllegalArgumentException("Window start must be <= end");
    }

    public boolean contains(Instant periodKey) {
        return !periodKey.isBefore(start) && !periodKey.isAfter(end);
    }
}
