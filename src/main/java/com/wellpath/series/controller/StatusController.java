package com.wellpath.series.controller;

import com.wellpath.series.model.ChartRange;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.service.SeriesService;
import com.wellpath.series.store.AggregateStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and service introspection.
 */
@RestController
public class StatusController {

    private final SeriesService seriesService;
    private final AggregateStore aggregateStore;

    public StatusController(SeriesService seriesService, AggregateStore aggregateStore) {
        this.seriesService = seriesService;
        this.aggregateStore = aggregateStore;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Detailed service status.
     * GET /status → stored aggregate counts, subjects, configured series.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().getEpochSecond(),
                "totalAggregatesStored", aggregateStore.totalRecords(),
                "knownSubjects", aggregateStore.knownSubjects(),
                "series", seriesService.seriesNames(),
                "supportedGranularities", Arrays.asList(Granularity.supportedLabels()),
                "supportedRanges", Arrays.asList(ChartRange.supportedLabels())
        ));
    }

    /**
     * Lists all supported granularities.
     * GET /granularities → ["daily", "weekly", "monthly"]
     */
    @GetMapping("/granularities")
    public ResponseEntity<List<String>> granularities() {
        return ResponseEntity.ok(Arrays.asList(Granularity.supportedLabels()));
    }

    /**
     * Lists all chart ranges with the granularity and look-back each one loads.
     * GET /ranges → [{"range": "W", "granularity": "daily", "back": 35, "ahead": 0}, ...]
     */
    @GetMapping("/ranges")
    public ResponseEntity<List<Map<String, Object>>> ranges() {
        return ResponseEntity.ok(Arrays.stream(ChartRange.values())
                .map(r -> Map.<String, Object>of(
                        "range", r.getLabel(),
                        "granularity", r.getGranularity().getLabel(),
                        "back", r.getUnitsBack(),
                        "ahead", r.getUnitsAhead()))
                .toList());
    }
}
