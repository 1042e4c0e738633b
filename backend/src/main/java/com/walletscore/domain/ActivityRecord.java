package com.walletscore.domain;

/**
 * One explorer transaction row, reduced to the fields feature extraction reads.
 * tokenSymbol and contractAddress are null for native and internal rows.
 */
public record ActivityRecord(
        String hash,
        long timestamp,
        String from,
        String to,
        String tokenSymbol,
        String contractAddress,
        ActivityCategory category
) {
}
