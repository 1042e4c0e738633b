package com.walletscore.domain;

public enum LendingDecision {
    ALLOW,
    LIMIT,
    DENY
}
