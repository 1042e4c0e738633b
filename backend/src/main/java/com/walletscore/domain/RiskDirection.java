package com.walletscore.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Direction of the score between two consecutive windows.
 */
public enum RiskDirection {
    IMPROVING,
    WORSENING,
    FLAT;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
