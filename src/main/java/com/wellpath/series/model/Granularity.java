package com.wellpath.series.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported calendar granularities for periodic aggregates.
 * Labels match the {@code period_type} values written by the upstream aggregation job.
 */
public enum Granularity {

    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String label;

    private static final Map<String, Granularity> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(Granularity::getLabel, Function.identity()));

    Granularity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Given a calendar date, compute the first day of the period it falls into.
     *
     * @param date      Any date inside the period
     * @param weekStart First day of the week, only used by {@link #WEEKLY}
     */
    public LocalDate periodStart(LocalDate date, DayOfWeek weekStart) {
        return switch (this) {
            case DAILY -> date;
            case WEEKLY -> date.with(TemporalAdjusters.previousOrSame(weekStart));
            case MONTHLY -> date.withDayOfMonth(1);
        };
    }

    /**
     * Shift a date by a whole number of units of this granularity (negative moves back).
     */
    public LocalDate plusUnits(LocalDate date, long units) {
        return switch (this) {
            case DAILY -> date.plusDays(units);
            case WEEKLY -> date.plusWeeks(units);
            case MONTHLY -> date.plusMonths(units);
        };
    }

    /**
     * Last calendar day of the period starting at {@code periodStart}:
     * the same day, six days later, or the last day of the month.
     */
    public LocalDate lastDay(LocalDate periodStart) {
        return switch (this) {
            case DAILY -> periodStart;
            case WEEKLY -> periodStart.plusDays(6);
            case MONTHLY -> periodStart.plusMonths(1).minusDays(1);
        };
    }

    /**
     * Look up a Granularity by its label string (e.g., "weekly").
     */
    public static Optional<Granularity> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    /**
     * Returns all supported label strings for validation or documentation.
     */
    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(Granularity::getLabel).toArray(String[]::new);
    }
}
