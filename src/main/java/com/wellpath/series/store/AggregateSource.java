package com.wellpath.series.store;

import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Data-access capability that feeds the series engine.
 * Scoping by subject and calculation type happens here, never in the engine.
 */
public interface AggregateSource {

    /**
     * Fetch aggregates for one subject whose period start lies in an inclusive range.
     *
     * @param subjectId       Subject whose aggregates are requested
     * @param granularity     Period type of the aggregates
     * @param calculationType Aggregation method (e.g., "AVG")
     * @param metricIds       Metrics to include
     * @param from            Earliest period start (inclusive)
     * @param to              Latest period start (inclusive)
     * @return Matching records sorted ascending by period start
     */
    List<AggregateRecord> find(String subjectId, Granularity granularity, String calculationType,
                               Collection<String> metricIds, Instant from, Instant to);
}
