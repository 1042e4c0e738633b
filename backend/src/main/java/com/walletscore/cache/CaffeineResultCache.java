package com.walletscore.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded Caffeine cache where each entry expires after the ttl it was put with.
 * Expiry is measured on the Caffeine ticker; cachedAt is taken from the wall clock for reporting.
 */
public class CaffeineResultCache<K, V> implements ResultCache<K, V> {

    private final Cache<K, CachedValue<V>> cache;
    private final Clock clock;

    public CaffeineResultCache(long maximumSize, Ticker ticker, Clock clock) {
        this.clock = Objects.requireNonNull(clock);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new Expiry<K, CachedValue<V>>() {
                    @Override
                    public long expireAfterCreate(K key, CachedValue<V> entry, long currentTime) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(K key, CachedValue<V> entry, long currentTime, long currentDuration) {
                        return entry.ttl().toNanos();
                    }

                    @Override
                    public long expireAfterRead(K key, CachedValue<V> entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public Optional<CachedValue<V>> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        cache.put(key, new CachedValue<>(value, clock.instant(), ttl));
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
