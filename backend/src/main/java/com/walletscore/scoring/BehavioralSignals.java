package com.walletscore.scoring;

import com.walletscore.domain.FeatureSnapshot;

/**
 * The snapshot fields that adjust LTV on top of the tier's base terms.
 */
public record BehavioralSignals(double stablecoinRatio, double consistencyScore, int normalTxCount, int internalTxCount) {

    public static BehavioralSignals from(FeatureSnapshot features) {
        return new BehavioralSignals(
                features.stablecoinRatio(),
                features.consistencyScore(),
                features.normalTxCount(),
                features.internalTxCount());
    }
}
