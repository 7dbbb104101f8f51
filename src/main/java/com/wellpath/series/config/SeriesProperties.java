package com.wellpath.series.config;

import com.wellpath.series.model.ValueField;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Calendar settings and named series definitions bound from {@code series.*}.
 *
 * @param zone            Zone identifier periods are aligned in (default "UTC")
 * @param weekStart       First day of week (default Monday)
 * @param calculationType Aggregation method fetched for every series (default "AVG")
 * @param definitions     Series name to definition
 */
@ConfigurationProperties(prefix = "series")
public record SeriesProperties(
        String zone,
        DayOfWeek weekStart,
        String calculationType,
        Map<String, Definition> definitions
) {

    public SeriesProperties {
        if (zone == null || zone.isBlank()) zone = "UTC";
        if (weekStart == null) weekStart = DayOfWeek.MONDAY;
        if (calculationType == null || calculationType.isBlank()) calculationType = "AVG";
        definitions = definitions == null ? Map.of() : new LinkedHashMap<>(definitions);
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("zone is not a valid zone id: " + zone, e);
        }
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public Optional<Definition> definition(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * @param valueField Raw field the series reads
     * @param metrics    Role name to metric id, in declaration order
     */
    public record Definition(ValueField valueField, Map<String, String> metrics) {

        public Definition {
            if (valueField == null) throw new IllegalArgumentException("value-field must be provided");
            if (metrics == null || metrics.isEmpty()) throw new IllegalArgumentException("metrics must be provided");
            metrics = new LinkedHashMap<>(metrics);
        }
    }
}
