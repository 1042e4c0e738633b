package com.walletscore.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Explorer activity list a record came from. Carries the upstream action name and the key under which a failed
 * fetch of this category is reported.
 */
@Getter
@RequiredArgsConstructor
public enum ActivityCategory {
    NATIVE("txlist", "normal"),
    INTERNAL("txlistinternal", "internal"),
    TOKEN("tokentx", "erc20");

    /** Error key of the first-ever activity lookup (not a category of its own). */
    public static final String FIRST_ACTIVITY_ERROR_KEY = "age";

    private final String action;
    private final String errorKey;
}
