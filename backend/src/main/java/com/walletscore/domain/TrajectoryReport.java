package com.walletscore.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Diff of two consecutive windows: relative deltas (0.0 when the previous value is zero), absolute deltas,
 * qualitative drivers and the derived labels.
 */
public record TrajectoryReport(
        Map<String, Double> deltas,
        Map<String, Double> absoluteDeltas,
        List<String> drivers,
        TrajectoryTrend trend,
        RiskDirection riskDirection
) {

    public TrajectoryReport {
        deltas = Collections.unmodifiableMap(new LinkedHashMap<>(deltas));
        absoluteDeltas = Collections.unmodifiableMap(new LinkedHashMap<>(absoluteDeltas));
        drivers = List.copyOf(drivers);
    }
}
