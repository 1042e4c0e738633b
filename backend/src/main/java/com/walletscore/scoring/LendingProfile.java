package com.walletscore.scoring;

import com.walletscore.domain.RiskTier;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lending venues and their base collateral terms per risk tier.
 */
public enum LendingProfile {

    AAVE("aave",
            new ProfileTerms(0.70, 0.80, 0.045),
            new ProfileTerms(0.55, 0.65, 0.070),
            new ProfileTerms(0.35, 0.45, 0.110)),
    MORPHO("morpho",
            new ProfileTerms(0.72, 0.82, 0.040),
            new ProfileTerms(0.58, 0.68, 0.065),
            new ProfileTerms(0.40, 0.50, 0.100));

    private final String profileName;
    private final ProfileTerms low;
    private final ProfileTerms medium;
    private final ProfileTerms high;

    LendingProfile(String profileName, ProfileTerms low, ProfileTerms medium, ProfileTerms high) {
        this.profileName = profileName;
        this.low = low;
        this.medium = medium;
        this.high = high;
    }

    public String profileName() {
        return profileName;
    }

    /** Base terms for a scored tier; UNKNOWN has none and is denied upstream of this. */
    public ProfileTerms termsFor(RiskTier tier) {
        return switch (tier) {
            case LOW -> low;
            case MEDIUM -> medium;
            case HIGH -> high;
            case UNKNOWN -> throw new IllegalArgumentException("No terms for tier UNKNOWN");
        };
    }

    /** Case-insensitive lookup by profile name. */
    public static Optional<LendingProfile> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(p -> p.profileName.equals(normalized)).findFirst();
    }

    public record ProfileTerms(double maxLtv, double collateralFactor, double apr) {
    }
}
