package com.walletscore.ingestion.adapter;

import com.walletscore.domain.ActivityRecord;
import com.walletscore.domain.FetchError;

import java.util.List;

/**
 * In-window records of one activity list. On error records is empty; truncated means the explorer's
 * 10,000-row ceiling was reached while pages were still full.
 */
public record WindowFetchResult(List<ActivityRecord> records, FetchError error, boolean truncated) {

    public WindowFetchResult {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static WindowFetchResult of(List<ActivityRecord> records, boolean truncated) {
        return new WindowFetchResult(records, null, truncated);
    }

    public static WindowFetchResult failed(FetchError error) {
        return new WindowFetchResult(List.of(), error, false);
    }

    public boolean isFailed() {
        return error != null;
    }
}
