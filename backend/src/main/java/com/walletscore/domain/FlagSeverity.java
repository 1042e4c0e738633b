package com.walletscore.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FlagSeverity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
