package com.walletscore.assessment;

import com.walletscore.domain.FeatureSnapshot;
import com.walletscore.domain.Recommendation;
import com.walletscore.domain.ScoreResult;
import com.walletscore.domain.WindowAssessment;

public record WalletAssessment(
        String wallet,
        String profile,
        FeatureSnapshot features,
        ScoreResult score,
        Recommendation recommendation
) {

    public WindowAssessment toWindowAssessment() {
        return new WindowAssessment(features, score);
    }
}
