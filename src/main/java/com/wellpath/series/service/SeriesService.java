package com.wellpath.series.service;

import com.wellpath.series.config.SeriesProperties;
import com.wellpath.series.engine.InvalidRangeException;
import com.wellpath.series.engine.SeriesEngine;
import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.ChartRange;
import com.wellpath.series.model.DateWindow;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.model.Series;
import com.wellpath.series.model.SeriesRequest;
import com.wellpath.series.store.AggregateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

/**
 * Loads named series for a subject:
 * <ul>
 *   <li>Resolves the series definition (roles, metric ids, value field) from {@link SeriesProperties}</li>
 *   <li>Computes the window and fetches matching aggregates through {@link AggregateSource}</li>
 *   <li>Hands the records to the {@link SeriesEngine}</li>
 * </ul>
 *
 * <p>The configured calculation type is applied at fetch time, so the engine only ever sees
 * one calculation type per metric and period.
 */
@Service
public class SeriesService {

    private static final Logger log = LoggerFactory.getLogger(SeriesService.class);

    private final AggregateSource aggregateSource;
    private final SeriesEngine engine;
    private final SeriesProperties properties;
    private final Clock clock;

    public SeriesService(AggregateSource aggregateSource, SeriesEngine engine,
                         SeriesProperties properties, Clock clock) {
        this.aggregateSource = aggregateSource;
        this.engine = engine;
        this.properties = properties;
        this.clock = clock;
    }

    public Series load(String subjectId, String seriesName, ChartRange range, Instant reference) {
        return load(subjectId, seriesName, range.getGranularity(), range.getUnitsBack(), range.getUnitsAhead(), reference);
    }

    /**
     * Load a named series for a subject.
     *
     * @param subjectId  Subject whose aggregates are charted
     * @param seriesName Name of a configured series definition
     * @param granularity Period size
     * @param unitsBack  Whole periods before the reference period
     * @param unitsAhead Whole periods after the reference period
     * @param reference  Anchor instant, or null for the current time
     * @throws IllegalArgumentException if the series is unknown or the units are negative
     * @throws com.wellpath.series.engine.InvalidRangeException if the window cannot be computed
     */
    public Series load(String subjectId, String seriesName, Granularity granularity,
                       int unitsBack, int unitsAhead, Instant reference) {
        SeriesProperties.Definition definition = properties.definition(seriesName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown series: " + seriesName));

        SeriesRequest request = new SeriesRequest(granularity, unitsBack, unitsAhead,
                properties.zoneId(), properties.weekStart(), definition.metrics(), definition.valueField());
        Instant anchor = reference != null ? reference : clock.instant();

        DateWindow window = engine.window(request, anchor);
        log.info("Loading series={} subject={} granularity={} window={} to {}",
                seriesName, subjectId, granularity.getLabel(), window.start(), window.end());

        List<AggregateRecord> records = aggregateSource.find(subjectId, granularity, properties.calculationType(),
                Set.copyOf(definition.metrics().values()), window.start(),
                lastInstantOf(window.end(), granularity, properties.zoneId()));
        return engine.load(records, request, window);
    }

    /**
     * Last instant of the period starting at {@code periodStart}. Records stamped anywhere inside
     * the final period belong to its bucket, so the fetch has to reach past its first instant.
     */
    private static Instant lastInstantOf(Instant periodStart, Granularity granularity, ZoneId zone) {
        try {
            LocalDate next = granularity.plusUnits(periodStart.atZone(zone).toLocalDate(), 1);
            return next.atStartOfDay(zone).toInstant().minusNanos(1);
        } catch (DateTimeException | ArithmeticException e) {
            throw new InvalidRangeException("Failed to calculate date range", e);
        }
    }

    /**
     * Names of all configured series, in declaration order.
     */
    public List<String> seriesNames() {
        return List.copyOf(properties.definitions().keySet());
    }
}
