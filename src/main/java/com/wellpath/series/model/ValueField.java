package com.wellpath.series.model;

/**
 * Which raw field of an {@link AggregateRecord} a series reads.
 */
public enum ValueField {

    /** Numeric {@code value}, passed through unchanged. */
    VALUE,

    /** Clock-time {@code valueTime}, parsed onto the anchor date. */
    VALUE_TIME;

    public boolean isPresent(AggregateRecord record) {
        return this == VALUE ? record.value() != null : record.valueTime() != null;
    }
}
