package com.wellpath.series.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wellpath.series.model.DataQualityWarning;
import com.wellpath.series.model.OutputPoint;
import com.wellpath.series.model.ResolvedValue;
import com.wellpath.series.model.Series;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST response DTO in a columnar, chart-friendly format.
 *
 * <pre>
 * {
 *   "s": "ok",
 *   "g": "daily",
 *   "from": "2024-01-01T00:00:00Z",
 *   "to": "2024-01-07T00:00:00Z",
 *   "t": ["2024-01-01T00:00:00Z", ...],
 *   "e": ["2024-01-01T00:00:00Z", ...],
 *   "v": {"bedtime": ["2000-01-01T23:15:00Z", ...], "waketime": [...]},
 *   "w": []
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesResponse(
        @JsonProperty("s") String status,
        @JsonProperty("g") String granularity,
        @JsonProperty("from") Instant from,
        @JsonProperty("to") Instant to,
        @JsonProperty("t") List<Instant> periodStarts,
        @JsonProperty("e") List<Instant> periodEnds,
        @JsonProperty("v") Map<String, List<ResolvedValue>> values,
        @JsonProperty("w") List<String> warnings
) {

    /**
     * Build a successful response from a non-empty series.
     */
    public static SeriesResponse ok(Series series) {
        List<Instant> t = new ArrayList<>();
        List<Instant> e = new ArrayList<>();
        Map<String, List<ResolvedValue>> v = new LinkedHashMap<>();

        for (OutputPoint point : series.points()) {
            t.add(point.periodStart());
            e.add(point.periodEnd());
            point.values().forEach((role, value) -> v.computeIfAbsent(role, k -> new ArrayList<>()).add(value));
        }

        return new SeriesResponse("ok", series.granularity().getLabel(),
                series.window().start(), series.window().end(), t, e, v, warnings(series));
    }

    /**
     * Build an empty successful response (no complete period in range).
     */
    public static SeriesResponse noData(Series series) {
        return new SeriesResponse("no_data", series.granularity().getLabel(),
                series.window().start(), series.window().end(), List.of(), List.of(), Map.of(), warnings(series));
    }

    /**
     * Build an error response.
     */
    public static SeriesResponse error(String message) {
        return new SeriesResponse("error: " + message, null, null, null,
                List.of(), List.of(), Map.of(), List.of());
    }

    private static List<String> warnings(Series series) {
        return series.warnings().stream().map(DataQualityWarning::toString).toList();
    }
}
