package com.walletscore.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store with per-entry lifetime. Expired entries are never returned.
 */
public interface ResultCache<K, V> {

    Optional<CachedValue<V>> get(K key);

    /** Stores or replaces the value for {@code key}; {@code ttl} must be positive. */
    void put(K key, V value, Duration ttl);
}
