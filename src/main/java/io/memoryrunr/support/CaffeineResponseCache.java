package io.memoryrunr.support;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link ResponseCache} backed by a Caffeine cache with a size bound and write TTL.
 */
public class CaffeineResponseCache<K, V> implements ResponseCache<K, V> {

    private final Cache<K, V> cache;

    public CaffeineResponseCache(long maximumSize, Duration ttl) {
        this(maximumSize, ttl, Ticker.systemTicker());
    }

    /** Constructor for testing with a controllable ticker. */
    public CaffeineResponseCache(long maximumSize, Duration ttl, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    public double hitRate() {
        return cache.stats().hitRate();
    }
}
