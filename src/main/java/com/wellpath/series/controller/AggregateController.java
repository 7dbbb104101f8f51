package com.wellpath.series.controller;

import com.wellpath.series.config.SeriesProperties;
import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.store.AggregateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accepts pre-aggregated records published by the upstream aggregation job.
 *
 * <pre>
 * POST /aggregates?subject=demo&amp;granularity=weekly&amp;calculationType=AVG
 * [{"agg_metric_id": "AGG_SLEEP_BEDTIME", "period_start": "2024-01-01T00:00:00Z", "value_time": "23:10"}]
 * </pre>
 */
@RestController
@RequestMapping("/aggregates")
public class AggregateController {

    private static final Logger log = LoggerFactory.getLogger(AggregateController.class);

    private final AggregateStore aggregateStore;
    private final SeriesProperties properties;

    public AggregateController(AggregateStore aggregateStore, SeriesProperties properties) {
        this.aggregateStore = aggregateStore;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(
            @RequestParam String subject,
            @RequestParam String granularity,
            @RequestParam(required = false) String calculationType,
            @RequestBody List<AggregateRecord> records
    ) {
        Optional<Granularity> parsedGranularity = Granularity.fromLabel(granularity);
        if (parsedGranularity.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("status", "error: Unsupported granularity: " + granularity));
        }
        if (subject.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("status", "error: Subject must not be blank"));
        }
        if (records.contains(null)) {
            return ResponseEntity.badRequest().body(Map.of("status", "error: Records must not be null"));
        }

        String calc = calculationType == null || calculationType.isBlank()
                ? properties.calculationType()
                : calculationType;
        int stored = aggregateStore.saveAll(subject, parsedGranularity.get(), calc, records);
        log.info("Ingested {} aggregates: subject={} granularity={} calc={}", stored, subject, granularity, calc);
        return ResponseEntity.ok(Map.of("status", "ok", "stored", stored));
    }
}
