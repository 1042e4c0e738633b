package com.walletscore.domain;

import java.util.List;

/**
 * Collateral terms for a lending profile. All terms are null when the wallet is denied.
 */
public record Recommendation(
        String profile,
        Double maxLtv,
        Double collateralFactor,
        Double apr,
        String policyLabel,
        List<String> rationale
) {

    public Recommendation {
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
    }

    public static Recommendation denied(String profile, List<String> rationale) {
        return new Recommendation(profile, null, null, null, profile + "-deny", rationale);
    }

    public boolean isDenied() {
        return maxLtv == null;
    }
}
