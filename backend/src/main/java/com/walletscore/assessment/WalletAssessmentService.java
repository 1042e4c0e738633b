package com.walletscore.assessment;

import com.walletscore.cache.CachedValue;
import com.walletscore.cache.ResultCache;
import com.walletscore.config.CacheProperties;
import com.walletscore.config.CaffeineConfig;
import com.walletscore.domain.FeatureSnapshot;
import com.walletscore.domain.Recommendation;
import com.walletscore.domain.ScoreResult;
import com.walletscore.domain.TimeWindow;
import com.walletscore.domain.TrajectoryReport;
import com.walletscore.features.FeatureExtractor;
import com.walletscore.ingestion.activity.WalletActivity;
import com.walletscore.ingestion.activity.WalletActivityFetcher;
import com.walletscore.scoring.BehavioralSignals;
import com.walletscore.scoring.LendingProfile;
import com.walletscore.scoring.RecommendationEngine;
import com.walletscore.scoring.ScoringEngine;
import com.walletscore.trajectory.TrajectoryComparator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point of the pipeline: validate, fetch, extract, score, recommend.
 * <p>
 * Only request validation throws ({@link InvalidAssessmentRequestException}, before any upstream call).
 * Upstream failures come back as data: dataOk=false, errors by key, tier UNKNOWN, decision DENY.
 * Snapshots with complete data are cached per (wallet, profile, window, offset); wallet addresses are
 * lowercased on entry so results and cached snapshots agree on the address.
 */
@Slf4j
@Service
public class WalletAssessmentService {

    private final AddressValidator addressValidator;
    private final WalletActivityFetcher activityFetcher;
    private final FeatureExtractor featureExtractor;
    private final ScoringEngine scoringEngine;
    private final RecommendationEngine recommendationEngine;
    private final TrajectoryComparator trajectoryComparator;
    private final ResultCache<String, FeatureSnapshot> featureCache;
    private final AssessmentProperties assessmentProperties;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public WalletAssessmentService(AddressValidator addressValidator,
                                   WalletActivityFetcher activityFetcher,
                                   FeatureExtractor featureExtractor,
                                   ScoringEngine scoringEngine,
                                   RecommendationEngine recommendationEngine,
                                   TrajectoryComparator trajectoryComparator,
                                   @Qualifier(CaffeineConfig.FEATURE_SNAPSHOT_CACHE) ResultCache<String, FeatureSnapshot> featureCache,
                                   AssessmentProperties assessmentProperties,
                                   CacheProperties cacheProperties,
                                   Clock clock) {
        this.addressValidator = addressValidator;
        this.activityFetcher = activityFetcher;
        this.featureExtractor = featureExtractor;
        this.scoringEngine = scoringEngine;
        this.recommendationEngine = recommendationEngine;
        this.trajectoryComparator = trajectoryComparator;
        this.featureCache = featureCache;
        this.assessmentProperties = assessmentProperties;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    public FeaturesResult computeFeatures(String wallet, String profile, int windowDays, int offsetDays) {
        String address = requireAddress(wallet);
        LendingProfile lendingProfile = resolveProfile(profile);
        requireWindow(windowDays, offsetDays);
        return features(address, lendingProfile, windowDays, offsetDays);
    }

    public WalletAssessment computeScore(String wallet, String profile) {
        return computeScore(wallet, profile, assessmentProperties.getDefaultWindowDays(), 0);
    }

    public WalletAssessment computeScore(String wallet, String profile, int windowDays, int offsetDays) {
        String address = requireAddress(wallet);
        LendingProfile lendingProfile = resolveProfile(profile);
        requireWindow(windowDays, offsetDays);
        return assess(address, lendingProfile, windowDays, offsetDays);
    }

    public WalletComparison compareWallets(String walletA, String walletB, String profile) {
        String a = requireAddress(walletA);
        String b = requireAddress(walletB);
        LendingProfile lendingProfile = resolveProfile(profile);
        int windowDays = assessmentProperties.getDefaultWindowDays();

        WalletAssessment first = assess(a, lendingProfile, windowDays, 0);
        WalletAssessment second = assess(b, lendingProfile, windowDays, 0);
        int scoreA = first.score().score();
        int scoreB = second.score().score();
        String winner = scoreA > scoreB ? a : scoreB > scoreA ? b : null;
        return new WalletComparison(first, second, winner, Math.abs(scoreA - scoreB));
    }

    public TrajectoryResult trajectory(String wallet, String profile, int windowDays) {
        String address = requireAddress(wallet);
        LendingProfile lendingProfile = resolveProfile(profile);
        requireWindow(windowDays, windowDays);

        WalletAssessment current = assess(address, lendingProfile, windowDays, 0);
        WalletAssessment previous = assess(address, lendingProfile, windowDays, windowDays);
        TrajectoryReport report = trajectoryComparator.compare(current.toWindowAssessment(), previous.toWindowAssessment());
        log.info("Trajectory for {} over {} days: trend={}, risk={}, drivers={}",
                address, windowDays, report.trend(), report.riskDirection(), report.drivers());
        return new TrajectoryResult(
                address,
                lendingProfile.profileName(),
                current.features().walletAgeDays(),
                current.toWindowAssessment(),
                previous.toWindowAssessment(),
                report);
    }

    private WalletAssessment assess(String address, LendingProfile profile, int windowDays, int offsetDays) {
        FeatureSnapshot features = features(address, profile, windowDays, offsetDays).features();
        ScoreResult score = scoringEngine.score(features);
        Recommendation recommendation = recommendationEngine.recommend(
                score.tier(), profile, BehavioralSignals.from(features), score.decision());
        return new WalletAssessment(address, profile.profileName(), features, score, recommendation);
    }

    private FeaturesResult features(String address, LendingProfile profile, int windowDays, int offsetDays) {
        String key = cacheKey(address, profile.profileName(), windowDays, offsetDays);
        Optional<CachedValue<FeatureSnapshot>> hit = featureCache.get(key);
        if (hit.isPresent()) {
            log.debug("Feature cache hit {}", key);
            return new FeaturesResult(address, profile.profileName(), hit.get().value(), true, hit.get().cachedAt());
        }

        Instant now = clock.instant();
        TimeWindow window = TimeWindow.of(now.getEpochSecond(), offsetDays, windowDays);
        WalletActivity activity = activityFetcher.fetch(address, window);
        FeatureSnapshot features = featureExtractor.extract(address, windowDays, offsetDays, activity, now.getEpochSecond());
        log.info("Computed features for {} (window={}d, offset={}d): dataOk={}, truncated={}, txCount={}",
                address, windowDays, offsetDays, features.dataOk(), features.truncated(), features.totalTxCount());

        if (features.dataOk()) {
            featureCache.put(key, features, Duration.ofSeconds(cacheProperties.getTtlSeconds()));
        } else {
            log.warn("Not caching features for {}: upstream errors {}", address, features.errors().keySet());
        }
        return new FeaturesResult(address, profile.profileName(), features, false, now);
    }

    /** Cache key covering every parameter that changes the snapshot. Addresses arrive lowercased. */
    static String cacheKey(String address, String profile, int windowDays, int offsetDays) {
        return "features:" + address + ":" + profile + ":" + windowDays + ":" + offsetDays;
    }

    private String requireAddress(String wallet) {
        if (!addressValidator.isValidAddress(wallet)) {
            throw new InvalidAssessmentRequestException(InvalidAssessmentRequestException.INVALID_ADDRESS,
                    "Invalid wallet address: " + wallet);
        }
        return wallet.trim().toLowerCase(Locale.ROOT);
    }

    private LendingProfile resolveProfile(String profile) {
        String name = profile == null || profile.isBlank() ? assessmentProperties.getDefaultProfile() : profile;
        return LendingProfile.fromName(name)
                .orElseThrow(() -> new InvalidAssessmentRequestException(InvalidAssessmentRequestException.UNKNOWN_PROFILE,
                        "Unknown lending profile: " + name));
    }

    private void requireWindow(int windowDays, int offsetDays) {
        if (windowDays < 1 || windowDays > assessmentProperties.getMaxWindowDays()) {
            throw new InvalidAssessmentRequestException(InvalidAssessmentRequestException.INVALID_WINDOW,
                    "windowDays must be between 1 and " + assessmentProperties.getMaxWindowDays() + ": " + windowDays);
        }
        if (offsetDays < 0) {
            throw new InvalidAssessmentRequestException(InvalidAssessmentRequestException.INVALID_WINDOW,
                    "offsetDays must not be negative: " + offsetDays);
        }
    }
}
