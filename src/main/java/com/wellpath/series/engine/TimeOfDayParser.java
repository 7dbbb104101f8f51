package com.wellpath.series.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Parses clock-time strings ("HH:MM" or "HH:MM:SS") into instants on a fixed anchor date.
 *
 * <p>Only the time component of the result is meaningful. Holding every value on
 * 2000-01-01 UTC lets bedtimes and waketimes from different days share one chart axis
 * regardless of the caller's zone.
 */
public class TimeOfDayParser {

    private static final Logger log = LoggerFactory.getLogger(TimeOfDayParser.class);

    public static final LocalDate ANCHOR_DATE = LocalDate.of(2000, 1, 1);

    /** Returned for malformed input: midnight on the anchor date. */
    public static final Instant FALLBACK = ANCHOR_DATE.atStartOfDay(ZoneOffset.UTC).toInstant();

    /**
     * Parse a clock time, falling back to {@link #FALLBACK} when it is malformed. Never throws.
     */
    public Instant parse(String clockTime) {
        return tryParse(clockTime).orElseGet(() -> {
            log.warn("Malformed clock time '{}', using {}", clockTime, FALLBACK);
            return FALLBACK;
        });
    }

    /**
     * Parse a clock time, or return empty when it is malformed.
     */
    public Optional<Instant> tryParse(String clockTime) {
        if (clockTime == null) return Optional.empty();

        String[] parts = clockTime.trim().split(":", -1);
        if (parts.length < 2 || parts.length > 3) return Optional.empty();

        int[] fields = new int[3];
        for (int i = 0; i < parts.length; i++) {
            Integer parsed = parseComponent(parts[i]);
            if (parsed == null) return Optional.empty();
            fields[i] = parsed;
        }

        int hour = fields[0];
        int minute = fields[1];
        int second = fields[2];
        if (hour > 23 || minute > 59 || second > 59) return Optional.empty();

        return Optional.of(ANCHOR_DATE.atTime(LocalTime.of(hour, minute, second))
                .toInstant(ZoneOffset.UTC));
    }

    private static Integer parseComponent(String part) {
        if (part.isEmpty() || part.length() > 2) return null;
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') return null;
        }
        return Integer.parseInt(part);
    }
}
