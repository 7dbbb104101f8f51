package com.wellpath.series.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * A single chart value: either a number or a time of day held on the anchor date.
 * Exactly one of the two components is set.
 */
public record ResolvedValue(Double number, Instant timeOfDay) {

    public ResolvedValue {
        if ((number == null) == (timeOfDay == null)) {
            throw new IllegalArgumentException("Exactly one of number or timeOfDay must be set");
        }
    }

    public static ResolvedValue numeric(double number) {
        return new ResolvedValue(number, null);
    }

    public static ResolvedValue timeOfDay(Instant timeOfDay) {
        return new ResolvedValue(null, timeOfDay);
    }

    public boolean isTimeOfDay() {
        return timeOfDay != null;
    }

    /** Serialized form: the bare number or the ISO-8601 instant. */
    @JsonValue
    public Object raw() {
        return number != null ? number : timeOfDay;
    }
}
