package com.walletscore.domain;

/**
 * Why an activity fetch produced no data.
 */
public enum FetchErrorKind {
    MISSING_CREDENTIAL,
    FATAL_UPSTREAM,
    RETRIES_EXHAUSTED,
    UNEXPECTED_PAYLOAD,
    FETCH_FAILED
}
