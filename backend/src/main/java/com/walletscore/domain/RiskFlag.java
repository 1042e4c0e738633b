package com.walletscore.domain;

/**
 * Qualitative warning attached to a score, e.g. no_erc20_activity_in_window.
 */
public record RiskFlag(String flag, FlagSeverity severity, String note) {
}
