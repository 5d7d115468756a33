package io.memoryrunr.support;

import java.util.Optional;

/**
 * Bounded, expiring cache for collaborator responses. Instances are injected, never shared statically.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface ResponseCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    long size();

    void invalidateAll();
}
