package com.wellpath.series.model;

import java.util.List;

/**
 * Result of a single load: the window that was requested, the complete periods inside it
 * in ascending order, and any data-quality warnings raised along the way.
 */
public record Series(Granularity granularity, DateWindow window, List<OutputPoint> points,
                     List<DataQualityWarning> warnings) {

    public Series {
        points = List.copyOf(points);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }
}
