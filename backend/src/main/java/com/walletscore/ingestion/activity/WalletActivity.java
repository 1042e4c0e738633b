package com.walletscore.ingestion.activity;

import com.walletscore.domain.ActivityCategory;
import com.walletscore.domain.FetchError;
import com.walletscore.ingestion.adapter.FirstActivityResult;
import com.walletscore.ingestion.adapter.WindowFetchResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything fetched for one wallet and one window: the three activity lists plus the first-ever activity.
 */
public record WalletActivity(
        WindowFetchResult normal,
        WindowFetchResult internal,
        WindowFetchResult token,
        FirstActivityResult firstActivity
) {

    public WalletActivity {
        Objects.requireNonNull(normal, "normal");
        Objects.requireNonNull(internal, "internal");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(firstActivity, "firstActivity");
    }

    public WindowFetchResult byCategory(ActivityCategory category) {
        return switch (category) {
            case NATIVE -> normal;
            case INTERNAL -> internal;
            case TOKEN -> token;
        };
    }

    public boolean anyTruncated() {
        return normal.truncated() || internal.truncated() || token.truncated();
    }

    /** Errors keyed by category error key, then "age" for the first-activity lookup. */
    public Map<String, FetchError> errors() {
        Map<String, FetchError> errors = new LinkedHashMap<>();
        for (ActivityCategory category : ActivityCategory.values()) {
            WindowFetchResult result = byCategory(category);
            if (result.isFailed()) {
                errors.put(category.getErrorKey(), result.error());
            }
        }
        if (firstActivity.isFailed()) {
            errors.put(ActivityCategory.FIRST_ACTIVITY_ERROR_KEY, firstActivity.error());
        }
        return errors;
    }
}
