package com.ryuqq.catalog.adapter.inmemory.cache;

import com.ryuqq.catalog.core.result.ErrorKind;
import com.ryuqq.catalog.core.result.Result;
import com.ryuqq.catalog.core.spi.ComputeCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link ComputeCache}.
 *
 * <p>Each key maps to one {@link CompletableFuture}. The first caller claims the key
 * with {@link ConcurrentHashMap#putIfAbsent} of an incomplete future, runs the
 * computation on its own thread and completes the future. Every other caller for
 * the same key blocks on that future.</p>
 *
 * <p><strong>Single-Flight Guarantee:</strong></p>
 * <ul>
 *   <li>The supplier runs at most once per key</li>
 *   <li>All callers observe the same {@link Result} instance</li>
 *   <li>Failures are cached; there is no eviction and no retry</li>
 * </ul>
 *
 * <p><strong>Failure Mapping:</strong></p>
 * <ul>
 *   <li>Supplier throws an exception or overflows the stack: {@code CACHE_COMPUTATION_ERROR}
 *       with the message, cached and returned to every caller</li>
 *   <li>Supplier returns null: {@code CACHE_COMPUTATION_ERROR}</li>
 *   <li>Any other {@link Error}: rethrown to the computing caller, waiters get it wrapped in a
 *       {@link java.util.concurrent.CompletionException}, and the key is released for a later retry</li>
 * </ul>
 *
 * <p>A supplier must not request its own key: that caller would wait on itself.</p>
 *
 * @param <K> key type
 * @param <V> value type
 *
 * @author Catalog Team
 * @since 1.0.0
 */
public class InMemoryComputeCache<K, V> implements ComputeCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryComputeCache.class);

    private final ConcurrentHashMap<K, CompletableFuture<Result<V>>> entries = new ConcurrentHashMap<>();

    @Override
    public Result<V> get(K key, Supplier<Result<V>> compute) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (compute == null) {
            throw new IllegalArgumentException("compute cannot be null");
        }

        CompletableFuture<Result<V>> existing = entries.get(key);
        if (existing == null) {
            CompletableFuture<Result<V>> claim = new CompletableFuture<>();
            existing = entries.putIfAbsent(key, claim);
            if (existing == null) {
                return computeAndPublish(key, compute, claim);
            }
        }

        if (!existing.isDone()) {
            log.debug("Waiting for in-flight computation of {}", key);
        }
        return existing.join();
    }

    private Result<V> computeAndPublish(K key, Supplier<Result<V>> compute, CompletableFuture<Result<V>> claim) {
        log.debug("Computing cache entry for {}", key);
        Result<V> result;
        try {
            result = runCompute(key, compute);
        } catch (Error e) {
            log.error("Cache computation for {} aborted", key, e);
            entries.remove(key, claim);
            claim.completeExceptionally(e);
            throw e;
        }
        claim.complete(result);
        return result;
    }

    private Result<V> runCompute(K key, Supplier<Result<V>> compute) {
        try {
            Result<V> result = compute.get();
            if (result == null) {
                log.warn("Cache computation for {} returned null", key);
                return Result.fail(ErrorKind.CACHE_COMPUTATION_ERROR, "computation returned no result for " + key);
            }
            return result;
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Cache computation for {} threw {}", key, e.toString());
            return Result.fail(ErrorKind.CACHE_COMPUTATION_ERROR,
                "computation failed for " + key + ": " + describe(e));
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    @Override
    public int size() {
        return entries.size();
    }

    /**
     * Removes all entries.
     *
     * <p>Computations already in flight still complete and release their waiters.</p>
     */
    @Override
    public void clear() {
        entries.clear();
    }
}
