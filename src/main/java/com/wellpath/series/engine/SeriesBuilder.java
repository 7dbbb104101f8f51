package com.wellpath.series.engine;

import com.wellpath.series.model.AggregateRecord;
import com.wellpath.series.model.DataQualityWarning;
import com.wellpath.series.model.OutputPoint;
import com.wellpath.series.model.ResolvedValue;
import com.wellpath.series.model.ValueField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns grouped aggregate records into complete chart points.
 *
 * <p>For each bucket, in ascending key order:
 * <ul>
 *   <li>every required role is matched to the first record in input order carrying its metric id;
 *       later records with the same metric id are ignored</li>
 *   <li>if any role has no record, or its record lacks the series' value field, the period is skipped;
 *       charts never show a fabricated point</li>
 *   <li>the period end is the first explicit end among the matched records, else the policy default</li>
 * </ul>
 *
 * <p>Malformed clock times do not drop the period. They resolve to the parser's fallback and are
 * reported to the warning sink.
 */
public class SeriesBuilder {

    private static final Logger log = LoggerFactory.getLogger(SeriesBuilder.class);

    private final TimeOfDayParser timeParser;

    public SeriesBuilder(TimeOfDayParser timeParser) {
        this.timeParser = timeParser;
    }

    public List<OutputPoint> build(Map<Instant, List<AggregateRecord>> grouped,
                                   Map<String, String> requiredMetricIds,
                                   ValueField valueField,
                                   PeriodEndPolicy periodEndPolicy) {
        return build(grouped, requiredMetricIds, valueField, periodEndPolicy, warning -> { });
    }

    /**
     * @param grouped           Buckets keyed by period start, any key order
     * @param requiredMetricIds Role name to metric id; every role must resolve for a period to be emitted
     * @param valueField        Raw field to read from each matched record
     * @param periodEndPolicy   Fallback for buckets without an explicit period end
     * @param warningSink       Receives one warning per malformed clock time
     * @return Complete points in strictly ascending period-start order
     */
    public List<OutputPoint> build(Map<Instant, List<AggregateRecord>> grouped,
                                   Map<String, String> requiredMetricIds,
                                   ValueField valueField,
                                   PeriodEndPolicy periodEndPolicy,
                                   Consumer<DataQualityWarning> warningSink) {
        List<Instant> keys = grouped.keySet().stream().sorted().toList();
        List<OutputPoint> points = new ArrayList<>(keys.size());

        for (Instant key : keys) {
            List<AggregateRecord> bucket = grouped.get(key);
            Map<String, AggregateRecord> matched = match(key, bucket, requiredMetricIds, valueField);
            if (matched == null) continue;

            Instant periodEnd = matched.values().stream()
                    .map(AggregateRecord::periodEnd)
                    .filter(Objects::nonNull)
                    .findFirst()
                    .orElseGet(() -> periodEndPolicy.periodEnd(key));

            Map<String, ResolvedValue> values = new LinkedHashMap<>();
            matched.forEach((role, record) -> values.put(role, resolve(key, record, valueField, warningSink)));

            points.add(new OutputPoint(key, periodEnd, values));
        }
        return points;
    }

    /** Returns role to record, or null when the period is incomplete. */
    private Map<String, AggregateRecord> match(Instant key, List<AggregateRecord> bucket,
                                               Map<String, String> requiredMetricIds, ValueField valueField) {
        Map<String, AggregateRecord> matched = new LinkedHashMap<>();
        for (Map.Entry<String, String> required : requiredMetricIds.entrySet()) {
            String metricId = required.getValue();
            List<AggregateRecord> candidates = bucket.stream()
                    .filter(r -> r.metricId().equals(metricId))
                    .toList();

            if (candidates.isEmpty()) {
                log.debug("Period {} missing metric {} ({}), skipped", key, metricId, required.getKey());
                return null;
            }
            if (candidates.size() > 1) {
                log.debug("Period {} has {} records for metric {}, keeping the first",
                        key, candidates.size(), metricId);
            }

            AggregateRecord first = candidates.get(0);
            if (!valueField.isPresent(first)) {
                log.debug("Period {} metric {} has no {}, skipped", key, metricId, valueField);
                return null;
            }
            matched.put(required.getKey(), first);
        }
        return matched;
    }

    private ResolvedValue resolve(Instant key, AggregateRecord record, ValueField valueField,
                                  Consumer<DataQualityWarning> warningSink) {
        if (valueField == ValueField.VALUE) {
            return ResolvedValue.numeric(record.value());
        }
        Optional<Instant> parsed = timeParser.tryParse(record.valueTime());
        if (parsed.isPresent()) {
            return ResolvedValue.timeOfDay(parsed.get());
        }
        DataQualityWarning warning = new DataQualityWarning(record.metricId(), key, record.valueTime(),
                "Malformed clock time, using " + TimeOfDayParser.FALLBACK);
        log.warn("Data quality: {}", warning);
        warningSink.accept(warning);
        return ResolvedValue.timeOfDay(TimeOfDayParser.FALLBACK);
    }
}
