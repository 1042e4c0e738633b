package com.walletscore.ingestion.adapter;

import com.walletscore.domain.FetchError;

import java.util.OptionalLong;

/**
 * Timestamp of the oldest native transaction of a wallet; null when it has none or the lookup failed.
 */
public record FirstActivityResult(Long timestamp, FetchError error) {

    public static FirstActivityResult found(long timestamp) {
        return new FirstActivityResult(timestamp, null);
    }

    public static FirstActivityResult none() {
        return new FirstActivityResult(null, null);
    }

    public static FirstActivityResult failed(FetchError error) {
        return new FirstActivityResult(null, error);
    }

    public OptionalLong firstTimestamp() {
        return timestamp == null ? OptionalLong.empty() : OptionalLong.of(timestamp);
    }

    public boolean isFailed() {
        return error != null;
    }
}
