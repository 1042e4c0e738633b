package com.walletscore.domain;

import java.util.List;

/**
 * Score in [0, 100] with tier, lending decision and the factor breakdown that produced it.
 */
public record ScoreResult(
        int score,
        RiskTier tier,
        LendingDecision decision,
        boolean hardGated,
        List<RiskFlag> flags,
        List<FactorScore> factors
) {

    public ScoreResult {
        if (score < 0 || score > 100) {
            throw new IllegalArgumentException("score out of range: " + score);
        }
        flags = flags == null ? List.of() : List.copyOf(flags);
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
