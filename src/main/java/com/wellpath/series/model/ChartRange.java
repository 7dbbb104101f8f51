package com.wellpath.series.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Named chart ranges offered by the sleep screens, each mapped to the granularity and
 * look-back it loads. Multi-month views are rolled up to weekly or monthly periods.
 */
public enum ChartRange {

    WEEK("W", Granularity.DAILY, 35, 0),
    MONTH("M", Granularity.DAILY, 33, 0),
    SIX_MONTHS("6M", Granularity.WEEKLY, 26, 0),
    YEAR("Y", Granularity.MONTHLY, 12, 0);

    private final String label;
    private final Granularity granularity;
    private final int unitsBack;
    private final int unitsAhead;

    private static final Map<String, ChartRange> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(ChartRange::getLabel, Function.identity()));

    ChartRange(String label, Granularity granularity, int unitsBack, int unitsAhead) {
        this.label = label;
        this.granularity = granularity;
        this.unitsBack = unitsBack;
        this.unitsAhead = unitsAhead;
    }

    public String getLabel() {
        return label;
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public int getUnitsBack() {
        return unitsBack;
    }

    public int getUnitsAhead() {
        return unitsAhead;
    }

    public static Optional<ChartRange> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(ChartRange::getLabel).toArray(String[]::new);
    }
}
