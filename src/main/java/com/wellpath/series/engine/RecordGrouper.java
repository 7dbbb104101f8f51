package com.wellpath.series.engine;

import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets aggregate records by the period their {@code periodStart} falls into.
 *
 * <p>Records keep their input order inside a bucket and are never deduplicated here.
 * The returned map has no defined key order; callers sort keys before use.
 */
public class RecordGrouper {

    private final CalendarWindow calendar;

    public RecordGrouper(CalendarWindow calendar) {
        this.calendar = calendar;
    }

    public Map<Instant, List<AggregateRecord>> group(Collection<AggregateRecord> records,
                                                     Granularity granularity, ZoneId zone) {
        return group(records, granularity, zone, DayOfWeek.MONDAY);
    }

    public Map<Instant, List<AggregateRecord>> group(Collection<AggregateRecord> records,
                                                     Granularity granularity, ZoneId zone, DayOfWeek weekStart) {
        Map<Instant, List<AggregateRecord>> buckets = new HashMap<>();
        for (AggregateRecord record : records) {
            Instant key = calendar.periodKey(record.periodStart(), granularity, zone, weekStart);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(record);
        }
        return buckets;
    }
}
