package com.walletscore.domain;

/**
 * Risk bucket of a scored wallet. UNKNOWN when any required fetch failed.
 */
public enum RiskTier {
    LOW,
    MEDIUM,
    HIGH,
    UNKNOWN
}
