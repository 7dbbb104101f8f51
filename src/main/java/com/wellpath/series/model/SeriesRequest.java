package com.wellpath.series.model;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call configuration of a series load.
 *
 * @param granularity       Period size
 * @param unitsBack         Whole periods before the reference period, non-negative
 * @param unitsAhead        Whole periods after the reference period, non-negative
 * @param zone              Zone periods are aligned in
 * @param weekStart         First day of week for weekly periods
 * @param requiredMetricIds Role name to metric id, iteration order preserved
 * @param valueField        Raw field the series reads
 */
public record SeriesRequest(
        Granularity granularity,
        int unitsBack,
        int unitsAhead,
        ZoneId zone,
        DayOfWeek weekStart,
        Map<String, String> requiredMetricIds,
        ValueField valueField
) {

    public SeriesRequest {
        if (granularity == null) throw new IllegalArgumentException("Granularity must not be null");
        if (unitsBack < 0) throw new IllegalArgumentException("unitsBack must be non-negative");
        if (unitsAhead < 0) throw new IllegalArgumentException("unitsAhead must be non-negative");
        if (requiredMetricIds == null || requiredMetricIds.isEmpty()) {
            throw new IllegalArgumentException("At least one required metric must be given");
        }
        if (valueField == null) throw new IllegalArgumentException("Value field must not be null");
        if (zone == null) zone = ZoneOffset.UTC;
        if (weekStart == null) weekStart = DayOfWeek.MONDAY;
        requiredMetricIds = Collections.unmodifiableMap(new LinkedHashMap<>(requiredMetricIds));
    }

    /**
     * UTC, Monday-start request.
     */
    public static SeriesRequest of(Granularity granularity, int unitsBack, int unitsAhead,
                                   Map<String, String> requiredMetricIds, ValueField valueField) {
        return new SeriesRequest(granularity, unitsBack, unitsAhead, ZoneOffset.UTC, DayOfWeek.MONDAY,
                requiredMetricIds, valueField);
    }
}
