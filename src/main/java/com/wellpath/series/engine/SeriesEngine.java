package com.wellpath.series.engine;

import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.DataQualityWarning;
import com.wellpath.series.model.DateWindow;
import com.wellpath.series.model.OutputPoint;
import com.wellpath.series.model.Series;
import com.wellpath.series.model.SeriesRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateless entry point of the bucketing engine.
 *
 * <ul>
 *   <li>Computes the requested window via {@link CalendarWindow}</li>
 *   <li>Buckets records via {@link RecordGrouper} and drops buckets outside the window</li>
 *   <li>Builds complete points via {@link SeriesBuilder}</li>
 * </ul>
 *
 * <p>Holds no mutable state, so one instance can serve concurrent callers.
 */
public class SeriesEngine {

    private static final Logger log = LoggerFactory.getLogger(SeriesEngine.class);

    private final CalendarWindow calendar;
    private final RecordGrouper grouper;
    private final SeriesBuilder builder;

    public SeriesEngine(CalendarWindow calendar, RecordGrouper grouper, SeriesBuilder builder) {
        this.calendar = calendar;
        this.grouper = grouper;
        this.builder = builder;
    }

    /**
     * @throws InvalidRangeException if the window cannot be computed
     */
    public DateWindow window(SeriesRequest request, Instant reference) {
        return calendar.computeWindow(reference, request.granularity(), request.unitsBack(),
                request.unitsAhead(), request.zone(), request.weekStart());
    }

    /**
     * Load a series around {@code reference}.
     *
     * @throws InvalidRangeException if the window cannot be computed
     */
    public Series load(Collection<AggregateRecord> records, SeriesRequest request, Instant reference) {
        return load(records, request, window(request, reference));
    }

    /**
     * Load a series for an already computed window.
     */
    public Series load(Collection<AggregateRecord> records, SeriesRequest request, DateWindow window) {
        Map<Instant, List<AggregateRecord>> grouped =
                grouper.group(records, request.granularity(), request.zone(), request.weekStart());

        Map<Instant, List<AggregateRecord>> inWindow = new HashMap<>();
        grouped.forEach((key, bucket) -> {
            if (window.contains(key)) inWindow.put(key, bucket);
        });

        List<DataQualityWarning> warnings = new ArrayList<>();
        List<OutputPoint> points = builder.build(inWindow, request.requiredMetricIds(), request.valueField(),
                PeriodEndPolicy.calendar(request.granularity(), request.zone()), warnings::add);

        log.info("Loaded {} {} points from {} records ({} periods in window, {} warnings) for {} to {}",
                points.size(), request.granularity().getLabel(), records.size(), inWindow.size(),
                warnings.size(), window.start(), window.end());
        return new Series(request.granularity(), window, points, warnings);
    }
}
