package com.walletscore.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value with the instant it was computed and the lifetime it was stored with.
 */
public record CachedValue<V>(V value, Instant cachedAt, Duration ttl) {

    public Instant expiresAt() {
        return cachedAt.plus(ttl);
    }
}
