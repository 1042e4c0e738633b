package com.walletscore.domain;

/**
 * Failed fetch of one activity category (or of the first-activity lookup).
 */
public record FetchError(FetchErrorKind kind, String message) {
}
