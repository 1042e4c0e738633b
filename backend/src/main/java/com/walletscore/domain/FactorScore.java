package com.walletscore.domain;

/**
 * Points one scoring factor contributed, with a human-readable note.
 */
public record FactorScore(String factor, int points, String note) {
}
