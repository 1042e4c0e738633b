package com.walletscore.assessment;

import com.walletscore.domain.FeatureSnapshot;

import java.time.Instant;

/**
 * Feature snapshot as served, with whether it came from the cache and when it was computed.
 */
public record FeaturesResult(String wallet, String profile, FeatureSnapshot features, boolean cached, Instant cachedAt) {
}
