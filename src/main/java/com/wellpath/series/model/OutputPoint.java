package com.wellpath.series.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One complete chart period. Every required role has a value.
 *
 * @param periodStart Start of the period (the bucket key)
 * @param periodEnd   Explicit end from the data, or the granularity default
 * @param values      Role name to resolved value, in the order the roles were requested
 */
public record OutputPoint(Instant periodStart, Instant periodEnd, Map<String, ResolvedValue> values) {

    public OutputPoint {
        if (periodStart == null || periodEnd == null) throw new IllegalArgumentException("Period bounds must not be null");
        if (values == null || values.isEmpty()) throw new IllegalArgumentException("Values must not be empty");
        if (values.containsValue(null)) throw new IllegalArgumentException("Values must not contain null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public ResolvedValue value(String role) {
        return values.get(role);
    }
}
