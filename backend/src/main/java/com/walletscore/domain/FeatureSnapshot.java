package com.walletscore.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Behavioral features of one wallet over one window. Counts of a failed category are zero and dataOk is false;
 * when truncated is set, counts are lower bounds.
 */
public record FeatureSnapshot(
        String wallet,
        int windowDays,
        int offsetDays,
        long walletAgeDays,
        int activeDays,
        double consistencyScore,
        int uniqueTokens,
        int uniqueCounterparties,
        double stablecoinRatio,
        int normalTxCount,
        int internalTxCount,
        int erc20TxCount,
        boolean dataOk,
        boolean truncated,
        Map<String, FetchError> errors
) {

    public FeatureSnapshot {
        errors = errors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public int totalTxCount() {
        return normalTxCount + internalTxCount + erc20TxCount;
    }

    public boolean hasNativeActivity() {
        return normalTxCount + internalTxCount > 0;
    }

    public boolean hasTokenActivity() {
        return erc20TxCount > 0;
    }
}
