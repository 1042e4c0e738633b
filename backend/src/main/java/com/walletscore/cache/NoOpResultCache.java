package com.walletscore.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Used when caching is switched off: stores nothing, returns nothing.
 */
public class NoOpResultCache<K, V> implements ResultCache<K, V> {

    @Override
    public Optional<CachedValue<V>> get(K key) {
        return Optional.empty();
    }

    @Override
    public void put(K key, V value, Duration ttl) {
    }
}
