package com.ryuqq.catalog.core.spi;

import com.ryuqq.catalog.core.result.Result;

import java.util.function.Supplier;

/**
 * Single-flight memoizing cache SPI.
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>For each key, {@code compute} runs at most once, even under concurrent calls</li>
 *   <li>Concurrent callers for the same key wait for and share the single result</li>
 *   <li>Failures are cached like successes</li>
 *   <li>A {@code compute} that throws or returns null yields {@code CACHE_COMPUTATION_ERROR}</li>
 * </ul>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public interface ComputeCache<K, V> {

    /**
     * Returns the cached result for a key, computing it on first use.
     *
     * @param key the key
     * @param compute computes the result when the key is absent
     * @return the (possibly shared) result
     */
    Result<V> get(K key, Supplier<Result<V>> compute);

    /**
     * Number of keys with a published or in-flight result.
     *
     * @return entry count
     */
    int size();

    /**
     * Removes every entry.
     */
    void clear();
}
