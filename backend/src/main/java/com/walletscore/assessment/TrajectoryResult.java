package com.walletscore.assessment;

import com.walletscore.domain.TrajectoryReport;
import com.walletscore.domain.WindowAssessment;

/**
 * Current window (offset 0) against the window immediately before it.
 */
public record TrajectoryResult(
        String wallet,
        String profile,
        long walletAgeDays,
        WindowAssessment current,
        WindowAssessment previous,
        TrajectoryReport report
) {
}
