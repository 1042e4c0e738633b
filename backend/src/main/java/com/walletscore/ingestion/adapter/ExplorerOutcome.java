package com.walletscore.ingestion.adapter;

/**
 * Classification of one explorer response. MALFORMED and RATE_LIMITED are transient and retried;
 * callers of {@link RetryingExplorerFetcher} only ever see SUCCESS, FATAL or RETRIES_EXHAUSTED.
 */
public enum ExplorerOutcome {
    SUCCESS,
    RATE_LIMITED,
    MALFORMED,
    FATAL,
    RETRIES_EXHAUSTED;

    public boolean isTransient() {
        return this == RATE_LIMITED || this == MALFORMED;
    }
}
