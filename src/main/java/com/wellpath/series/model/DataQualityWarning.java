package com.wellpath.series.model;

import java.time.Instant;

/**
 * Non-fatal anomaly in a single input record. Processing continues with a fallback value.
 */
public record DataQualityWarning(String metricId, Instant periodStart, String rawValue, String message) {

    @Override
    public String toString() {
        return metricId + " @ " + periodStart + ": " + message + " (raw='" + rawValue + "')";
    }
}
