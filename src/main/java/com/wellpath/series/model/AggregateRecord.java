package com.wellpath.series.model;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.time.Instant;

/**
 * One pre-aggregated measurement: a single metric over a single calendar period for one subject.
 * Subject and calculation type are resolved before records reach the engine.
 *
 * @param metricId    Aggregated metric identifier (e.g., "AGG_SLEEP_BEDTIME")
 * @param periodStart Start instant of the aggregation period (UTC)
 * @param periodEnd   End of the period, or null to derive it from the granularity
 * @param value       Numeric value, may be null
 * @param valueTime   Clock time "HH:MM[:SS]" for time-of-day metrics, may be null
 */
public record AggregateRecord(
        @JsonAlias("agg_metric_id") String metricId,
        @JsonAlias("period_start") Instant periodStart,
        @JsonAlias("period_end") Instant periodEnd,
        Double value,
        @JsonAlias("value_time") String valueTime
) {

    public AggregateRecord {
        if (metricId == null || metricId.isBlank()) throw new IllegalArgumentException("Metric id must not be blank");
        if (periodStart == null) throw new IllegalArgumentException("Period start must not be null");
        if (periodEnd != null && periodEnd.isBefore(periodStart)) {
            throw new IllegalArgumentException("Period end must not be before period start");
        }
    }

    public static AggregateRecord ofTime(String metricId, Instant periodStart, String valueTime) {
        return new AggregateRecord(metricId, periodStart, null, null, valueTime);
    }

    public static AggregateRecord ofValue(String metricId, Instant periodStart, double value) {
        return new AggregateRecord(metricId, periodStart, null, value, null);
    }
}
