package com.walletscore.scoring;

/**
 * Thresholds and point values of the v1 scoring policy. Changing any of them changes every score.
 */
public final class ScoringPolicy {

    public static final String VERSION = "v1";

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    public static final int BASE_POINTS = 20;
    public static final int ACTIVE_DAYS_CAP = 30;
    public static final int TOKEN_DIVERSITY_CAP = 10;

    public static final int COUNTERPARTIES_TIER_1 = 10;
    public static final int COUNTERPARTIES_TIER_2 = 50;
    public static final int COUNTERPARTIES_TIER_3 = 200;

    public static final long AGE_ONE_YEAR_DAYS = 365;
    public static final long AGE_HALF_YEAR_DAYS = 180;
    public static final long AGE_QUARTER_DAYS = 90;

    public static final double STABLECOIN_HIGH_SHARE = 0.5;
    public static final double STABLECOIN_SOME_SHARE = 0.2;

    public static final int NO_TOKEN_ACTIVITY_PENALTY = -25;
    public static final int NO_NATIVE_ACTIVITY_PENALTY = -10;
    public static final int TRUNCATED_HISTORY_PENALTY = -3;

    /** Wallets younger than this are denied regardless of score. */
    public static final long MIN_WALLET_AGE_DAYS = 30;

    public static final int LOW_RISK_MIN_SCORE = 60;
    public static final int MEDIUM_RISK_MIN_SCORE = 35;

    private ScoringPolicy() {
    }
}
