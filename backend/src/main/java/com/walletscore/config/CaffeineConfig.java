package com.walletscore.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.walletscore.cache.CaffeineResultCache;
import com.walletscore.cache.NoOpResultCache;
import com.walletscore.cache.ResultCache;
import com.walletscore.domain.FeatureSnapshot;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Caffeine in-process cache for feature snapshots, keyed by every request parameter that affects the result.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CaffeineConfig {

    public static final String FEATURE_SNAPSHOT_CACHE = "featureSnapshotCache";

    @Bean(name = FEATURE_SNAPSHOT_CACHE)
    public ResultCache<String, FeatureSnapshot> featureSnapshotCache(CacheProperties cacheProperties, Clock clock) {
        if (!cacheProperties.isEnabled()) {
            return new NoOpResultCache<>();
        }
        return new CaffeineResultCache<>(cacheProperties.getMaximumSize(), Ticker.systemTicker(), clock);
    }
}
