package com.walletscore.scoring;

import com.walletscore.domain.LendingDecision;
import com.walletscore.domain.Recommendation;
import com.walletscore.domain.RiskTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps tier and profile to collateral terms, nudges LTV by behavioral signals and clamps it.
 * A DENY decision or an UNKNOWN tier always yields null terms.
 */
@Component
public class RecommendationEngine {

    static final double MIN_LTV = 0.15;
    static final double MAX_LTV = 0.75;
    static final double LTV_STEP = 0.05;
    static final double HIGH_STABLECOIN_RATIO = 0.6;
    static final double LOW_CONSISTENCY = 0.1;

    public Recommendation recommend(RiskTier tier, LendingProfile profile, BehavioralSignals signals,
                                    LendingDecision decision) {
        String name = profile.profileName();
        if (decision == LendingDecision.DENY || tier == RiskTier.UNKNOWN) {
            List<String> rationale = new ArrayList<>();
            rationale.add(tier == RiskTier.UNKNOWN
                    ? "Upstream data incomplete; no terms offered"
                    : "Lending decision is DENY for tier " + tier);
            return Recommendation.denied(name, rationale);
        }

        LendingProfile.ProfileTerms base = profile.termsFor(tier);
        List<String> rationale = new ArrayList<>();
        rationale.add(String.format(Locale.ROOT, "Base %s terms for tier %s: maxLtv %.2f", name, tier, base.maxLtv()));

        double ltv = base.maxLtv();
        if (signals.stablecoinRatio() >= HIGH_STABLECOIN_RATIO) {
            ltv += LTV_STEP;
            rationale.add("High stablecoin share: +0.05 LTV");
        }
        if (signals.consistencyScore() < LOW_CONSISTENCY) {
            ltv -= LTV_STEP;
            rationale.add("Low activity consistency: -0.05 LTV");
        }
        if (signals.internalTxCount() > signals.normalTxCount()) {
            ltv -= LTV_STEP;
            rationale.add("Internal calls exceed normal transactions: -0.05 LTV");
        }
        double adjusted = round4(ltv);
        double clamped = Math.max(MIN_LTV, Math.min(MAX_LTV, adjusted));
        if (clamped != adjusted) {
            rationale.add(String.format(Locale.ROOT, "LTV clamped to [%.2f, %.2f]", MIN_LTV, MAX_LTV));
        }

        return new Recommendation(
                name,
                clamped,
                base.collateralFactor(),
                base.apr(),
                name + "-" + tier.name().toLowerCase(Locale.ROOT),
                rationale);
    }

    private static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP).doubleValue();
    }
}
