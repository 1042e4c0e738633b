package com.walletscore.domain;

/**
 * One page of an explorer account list. The explorer refuses page * offset beyond 10,000 rows, which bounds how
 * far back any list can be read.
 */
public record PageRequest(ActivityCategory category, String address, int page, int pageSize, SortOrder sort) {

    public static final int PAGE_SIZE = 1000;
    public static final int MAX_PAGES = 10;
    public static final int RESULT_CEILING = 10_000;

    public PageRequest {
        if (category == null || address == null || sort == null) {
            throw new IllegalArgumentException("category, address and sort are required");
        }
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("page and pageSize must be positive");
        }
        if ((long) page * pageSize > RESULT_CEILING) {
            throw new IllegalArgumentException("page * pageSize exceeds explorer ceiling of " + RESULT_CEILING);
        }
    }

    public static PageRequest windowPage(ActivityCategory category, String address, int page, SortOrder sort) {
        return new PageRequest(category, address, page, PAGE_SIZE, sort);
    }

    /**
     * Single oldest native transaction: used to date the wallet independently of any window.
     */
    public static PageRequest firstActivity(String address) {
        return new PageRequest(ActivityCategory.NATIVE, address, 1, 1, SortOrder.ASC);
    }
}
