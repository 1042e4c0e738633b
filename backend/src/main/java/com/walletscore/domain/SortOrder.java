package com.walletscore.domain;

import java.util.Locale;

/**
 * Explorer list ordering by block.
 */
public enum SortOrder {
    ASC,
    DESC;

    public String paramValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
