package com.walletscore.scoring;

import com.walletscore.domain.ActivityCategory;
import com.walletscore.domain.FactorScore;
import com.walletscore.domain.FeatureSnapshot;
import com.walletscore.domain.FlagSeverity;
import com.walletscore.domain.LendingDecision;
import com.walletscore.domain.RiskFlag;
import com.walletscore.domain.RiskTier;
import com.walletscore.domain.ScoreResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.walletscore.scoring.ScoringPolicy.*;

/**
 * Deterministic 0..100 score from a feature snapshot.
 * <p>
 * Hard gate first (too young, or no token transfers or tokens in the window), then additive factors recorded in order,
 * then tier and decision. A snapshot with fetch errors gets tier UNKNOWN and is denied.
 */
@Component
public class ScoringEngine {

    public ScoreResult score(FeatureSnapshot features) {
        boolean tooYoung = features.walletAgeDays() < MIN_WALLET_AGE_DAYS;
        boolean hardGated = tooYoung || features.uniqueTokens() == 0 || !features.hasTokenActivity();

        List<FactorScore> factors = factors(features);
        int raw = factors.stream().mapToInt(FactorScore::points).sum();
        int score = Math.max(MIN_SCORE, Math.min(MAX_SCORE, raw));

        RiskTier tier = features.dataOk() ? tierFor(score) : RiskTier.UNKNOWN;
        LendingDecision decision = decisionFor(tier, hardGated);

        return new ScoreResult(score, tier, decision, hardGated, flags(features, tooYoung), factors);
    }

    static RiskTier tierFor(int score) {
        if (score >= LOW_RISK_MIN_SCORE) {
            return RiskTier.LOW;
        }
        if (score >= MEDIUM_RISK_MIN_SCORE) {
            return RiskTier.MEDIUM;
        }
        return RiskTier.HIGH;
    }

    static LendingDecision decisionFor(RiskTier tier, boolean hardGated) {
        if (hardGated) {
            return LendingDecision.DENY;
        }
        return switch (tier) {
            case LOW -> LendingDecision.ALLOW;
            case MEDIUM -> LendingDecision.LIMIT;
            case HIGH, UNKNOWN -> LendingDecision.DENY;
        };
    }

    private static List<FactorScore> factors(FeatureSnapshot f) {
        List<FactorScore> factors = new ArrayList<>();
        factors.add(new FactorScore("base", BASE_POINTS, "baseline, policy " + VERSION));
        factors.add(new FactorScore("active_days", Math.min(ACTIVE_DAYS_CAP, f.activeDays()),
                format("%d active days in %d-day window", f.activeDays(), f.windowDays())));
        factors.add(new FactorScore("token_diversity", Math.min(TOKEN_DIVERSITY_CAP, f.uniqueTokens() / 2),
                format("%d distinct tokens", f.uniqueTokens())));
        factors.add(new FactorScore("counterparties", counterpartyPoints(f.uniqueCounterparties()),
                format("%d distinct counterparties", f.uniqueCounterparties())));
        factors.add(new FactorScore("wallet_age", agePoints(f.walletAgeDays()),
                format("first activity %d days ago", f.walletAgeDays())));
        factors.add(new FactorScore("stablecoin_share", stablecoinPoints(f.stablecoinRatio()),
                format("stablecoin share %.4f", f.stablecoinRatio())));
        if (!f.hasTokenActivity()) {
            factors.add(new FactorScore("no_token_activity", NO_TOKEN_ACTIVITY_PENALTY,
                    "no token transfers in window"));
        }
        if (!f.hasNativeActivity()) {
            factors.add(new FactorScore("no_native_activity", NO_NATIVE_ACTIVITY_PENALTY,
                    "no native or internal transactions in window"));
        }
        if (f.truncated()) {
            factors.add(new FactorScore("truncated_history", TRUNCATED_HISTORY_PENALTY,
                    "history truncated at the explorer row ceiling"));
        }
        return factors;
    }

    static int counterpartyPoints(int counterparties) {
        if (counterparties >= COUNTERPARTIES_TIER_3) {
            return 15;
        }
        if (counterparties >= COUNTERPARTIES_TIER_2) {
            return 10;
        }
        if (counterparties >= COUNTERPARTIES_TIER_1) {
            return 5;
        }
        return 0;
    }

    static int agePoints(long ageDays) {
        if (ageDays >= AGE_ONE_YEAR_DAYS) {
            return 10;
        }
        if (ageDays >= AGE_HALF_YEAR_DAYS) {
            return 6;
        }
        if (ageDays >= AGE_QUARTER_DAYS) {
            return 3;
        }
        return 0;
    }

    static int stablecoinPoints(double ratio) {
        if (ratio >= STABLECOIN_HIGH_SHARE) {
            return 5;
        }
        if (ratio >= STABLECOIN_SOME_SHARE) {
            return 2;
        }
        return 0;
    }

    private static List<RiskFlag> flags(FeatureSnapshot f, boolean tooYoung) {
        List<RiskFlag> flags = new ArrayList<>();
        if (!f.dataOk()) {
            flags.add(new RiskFlag("data_unavailable", FlagSeverity.HIGH,
                    "Upstream data missing for: " + String.join(", ", f.errors().keySet())));
        }
        if (tooYoung) {
            String note = f.errors().containsKey(ActivityCategory.FIRST_ACTIVITY_ERROR_KEY)
                    ? format("Wallet age unknown (first-activity lookup failed); %d-day minimum not verified",
                            MIN_WALLET_AGE_DAYS)
                    : format("Wallet age %d days is below the %d-day minimum", f.walletAgeDays(), MIN_WALLET_AGE_DAYS);
            flags.add(new RiskFlag("wallet_too_young", FlagSeverity.HIGH, note));
        }
        if (!f.hasNativeActivity()) {
            flags.add(new RiskFlag("no_eth_activity_in_window", FlagSeverity.MEDIUM,
                    "No normal/internal ETH tx in the selected window."));
        }
        if (!f.hasTokenActivity()) {
            flags.add(new RiskFlag("no_erc20_activity_in_window", FlagSeverity.HIGH,
                    "No ERC20 transfers in the selected window."));
        }
        if (f.truncated()) {
            flags.add(new RiskFlag("history_truncated", FlagSeverity.MEDIUM,
                    "Explorer pagination limit reached; counts are lower bounds."));
        }
        return flags;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
