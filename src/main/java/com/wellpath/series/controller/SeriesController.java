package com.wellpath.series.controller;

import com.wellpath.series.engine.InvalidRangeException;
import com.wellpath.series.model.ChartRange;
import com.wellpath.series.model.Granularity;
import com.wellpath.series.model.Series;
import com.wellpath.series.service.SeriesService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * REST controller exposing calendar-aligned series.
 *
 * <pre>
 * GET /series?subject=demo&amp;series=sleep-consistency&amp;range=6M
 * GET /series?subject=demo&amp;series=sleep-duration&amp;granularity=daily&amp;back=14&amp;ahead=0&amp;at=2024-03-01T00:00:00Z
 * </pre>
 */
@RestController
@RequestMapping("/series")
@CrossOrigin(origins = "*") // Allow any frontend to query, restrict in production
public class SeriesController {

    private static final Logger log = LoggerFactory.getLogger(SeriesController.class);

    private final SeriesService seriesService;

    public SeriesController(SeriesService seriesService) {
        this.seriesService = seriesService;
    }

    /**
     * Fetch a named series for a subject, either by chart range or by explicit granularity and units.
     *
     * @param subject     Subject identifier
     * @param series      Configured series name (e.g., "sleep-consistency")
     * @param range       Chart range label ("W", "M", "6M", "Y"); wins over granularity
     * @param granularity Granularity label ("daily", "weekly", "monthly")
     * @param back        Whole periods before the reference period; ignored when a range is given
     * @param ahead       Whole periods after the reference period; ignored when a range is given
     * @param at          ISO-8601 reference instant, defaults to now
     * @return Columnar series response
     */
    @GetMapping
    public ResponseEntity<SeriesResponse> getSeries(
            @RequestParam String subject,
            @RequestParam String series,
            @RequestParam(required = false) String range,
            @RequestParam(required = false) String granularity,
            @RequestParam(defaultValue = "0") int back,
            @RequestParam(defaultValue = "0") int ahead,
            @RequestParam(required = false) String at
    ) {
        log.info("Series request: subject={} series={} range={} granularity={} back={} ahead={} at={}",
                subject, series, range, granularity, back, ahead, at);

        if (subject.isBlank()) {
            return ResponseEntity.badRequest().body(SeriesResponse.error("Subject must not be blank"));
        }
        if (!seriesService.seriesNames().contains(series)) {
            log.warn("Unknown series requested: {}", series);
            return ResponseEntity.badRequest()
                    .body(SeriesResponse.error("Unknown series: " + series
                            + ". Supported: " + String.join(", ", seriesService.seriesNames())));
        }

        if (back < 0 || ahead < 0) {
            return ResponseEntity.badRequest()
                    .body(SeriesResponse.error("'back' and 'ahead' must be non-negative"));
        }

        Instant reference = null;
        if (at != null) {
            try {
                reference = Instant.parse(at);
            } catch (DateTimeParseException e) {
                return ResponseEntity.badRequest().body(SeriesResponse.error("'at' must be an ISO-8601 instant"));
            }
        }

        Optional<ChartRange> chartRange = Optional.empty();
        Optional<Granularity> parsedGranularity = Optional.empty();
        if (range != null) {
            chartRange = ChartRange.fromLabel(range);
            if (chartRange.isEmpty()) {
                return ResponseEntity.badRequest()
                        .body(SeriesResponse.error("Unsupported range: " + range
                                + ". Supported: " + String.join(", ", ChartRange.supportedLabels())));
            }
        } else if (granularity != null) {
            parsedGranularity = Granularity.fromLabel(granularity);
            if (parsedGranularity.isEmpty()) {
                log.warn("Invalid granularity requested: {}", granularity);
                return ResponseEntity.badRequest()
                        .body(SeriesResponse.error("Unsupported granularity: " + granularity
                                + ". Supported: " + String.join(", ", Granularity.supportedLabels())));
            }
        } else {
            return ResponseEntity.badRequest()
                    .body(SeriesResponse.error("Either 'range' or 'granularity' is required"));
        }

        Series result;
        try {
            result = chartRange.isPresent()
                    ? seriesService.load(subject, series, chartRange.get(), reference)
                    : seriesService.load(subject, series, parsedGranularity.get(), back, ahead, reference);
        } catch (InvalidRangeException e) {
            log.warn("Date range failure for subject={} series={}: {}", subject, series, e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(SeriesResponse.error("Failed to calculate date range"));
        }

        if (result.isEmpty()) {
            log.debug("No complete periods for subject={} series={}", subject, series);
            return ResponseEntity.ok(SeriesResponse.noData(result));
        }

        log.info("Returning {} points for subject={} series={}", result.points().size(), subject, series);
        return ResponseEntity.ok(SeriesResponse.ok(result));
    }
}
