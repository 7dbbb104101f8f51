package com.wellpath.series.model;

import java.time.Instant;

/**
 * Composite key identifying one stored aggregate.
 * Uses Java record for automatic equals/hashCode, safe for use as ConcurrentHashMap key.
 *
 * @param subjectId       Subject the aggregate belongs to
 * @param granularity     Period type
 * @param calculationType Aggregation method (e.g., "AVG")
 * @param metricId        Aggregated metric
 * @param periodStart     Period start instant
 */
public record AggregateKey(String subjectId, Granularity granularity, String calculationType,
                           String metricId, Instant periodStart) {}
