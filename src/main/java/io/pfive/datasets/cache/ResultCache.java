// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.datasets.cache;

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.pfive.datasets.Configuration;
import io.pfive.datasets.exception.DatasetException;
import io.pfive.datasets.util.ByteSizeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/// Holds results that are expensive to compute (tiles of derived grids, query results) keyed by
/// their canonical CacheKey. This class must be threadsafe as it is shared by all worker threads of
/// an analysis run.
///
/// The main guarantee is single-flight computation: for any key, at most one computation runs at a
/// time, and callers arriving while it runs wait for its outcome instead of starting their own.
/// A plain Caffeine Cache.get() gives the first half of that, but if the computation throws, a
/// caller blocked on the same key simply runs the computation again. Here the waiters must receive
/// the first caller's failure. So this holds CompletableFutures in an AsyncCache: the first caller
/// installs an incomplete future and computes in its own thread, and everyone else joins that
/// future. A future that completes exceptionally is removed, so a later call retries cleanly.
///
/// Permanent failures (DatasetException.isPermanent(), e.g. incompatible inputs) would fail the same
/// way on every retry, so they are kept in the cache and rethrown without recomputation.
///
/// Bounds come from the Configuration: a maximum number of entries or a maximum total weight in
/// bytes (values implementing ByteSize report their own weight), and optionally an expiry after
/// write. With none set the cache is unbounded.
public class ResultCache {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final AsyncCache<CacheKey, Object> cache;
    private final LongAdder hits = new LongAdder();
    private final LongAdder computations = new LongAdder();
    private final LongAdder failures = new LongAdder();

    public ResultCache (Configuration configuration) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder();
        // Run cache maintenance in the calling thread so that removal of failed entries is immediate.
        builder.executor(Runnable::run);
        if (configuration.cacheMaximumEntries.isPresent()) {
            builder.maximumSize(configuration.cacheMaximumEntries.getAsLong());
        }
        if (configuration.cacheMaximumBytes.isPresent()) {
            builder.maximumWeight(configuration.cacheMaximumBytes.getAsLong());
            builder = builder.weigher((Object key, Object value) -> weigh(value));
        }
        if (configuration.cacheExpireAfterWrite() != null) {
            builder.expireAfterWrite(configuration.cacheExpireAfterWrite());
        }
        this.cache = builder.buildAsync();
    }

    /// An unbounded cache.
    public ResultCache () {
        this(Configuration.defaults());
    }

    private static int weigh (Object value) {
        if (value instanceof PermanentFailure) return 1;
        return (int) Math.min(Integer.MAX_VALUE, ByteSizeUtil.byteSizeOf(value));
    }

    /// Return the cached result for the key, computing it in this thread if it is absent. Concurrent
    /// calls for the same key block until the one computation completes and then all receive its
    /// result or its exception. The computation must not return null and must not request the same
    /// key recursively.
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute (CacheKey key, Supplier<T> compute) {
        checkNotNull(key, "key");
        CompletableFuture<Object> created = new CompletableFuture<>();
        CompletableFuture<Object> existing = cache.asMap().putIfAbsent(key, created);
        if (existing != null) {
            hits.increment();
            return (T) awaitResult(existing);
        }
        computations.increment();
        LOG.debug("Computing {}", key);
        T result;
        try {
            result = compute.get();
            if (result == null) {
                throw new IllegalStateException("Computation for " + key + " returned null.");
            }
        } catch (DatasetException e) {
            failures.increment();
            if (e.isPermanent()) {
                created.complete(new PermanentFailure(e));
            } else {
                discard(key, created, e);
            }
            throw e;
        } catch (RuntimeException | Error e) {
            failures.increment();
            discard(key, created, e);
            throw e;
        }
        created.complete(result);
        return result;
    }

    /// Fail the in-flight future so that waiters see the failure, and make sure it is gone from the map.
    private void discard (CacheKey key, CompletableFuture<Object> future, Throwable failure) {
        future.completeExceptionally(failure);
        cache.asMap().remove(key, future);
        LOG.debug("Computation failed for {}, not cached: {}", key, failure.toString());
    }

    private static Object awaitResult (CompletableFuture<Object> future) {
        Object value;
        try {
            value = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a cached computation.", e);
        } catch (ExecutionException | CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) throw runtimeException;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Cached computation failed.", cause);
        }
        if (value instanceof PermanentFailure permanentFailure) {
            throw permanentFailure.exception;
        }
        return value;
    }

    /// Returns true if a value, an in-flight computation, or a permanent failure is held for the key.
    public boolean contains (CacheKey key) {
        return cache.asMap().containsKey(key);
    }

    public void invalidate (CacheKey key) {
        cache.synchronous().invalidate(key);
    }

    public void invalidateAll () {
        cache.synchronous().invalidateAll();
    }

    public long estimatedSize () {
        return cache.synchronous().estimatedSize();
    }

    /// Number of calls that found an existing entry (completed or in flight).
    public long hitCount () {
        return hits.sum();
    }

    /// Number of computations started, successful or not.
    public long computeCount () {
        return computations.sum();
    }

    public long failureCount () {
        return failures.sum();
    }

    @Override
    public String toString () {
        return String.format("ResultCache[entries=%d, hits=%d, computations=%d, failures=%d]",
              estimatedSize(), hitCount(), computeCount(), failureCount());
    }

    /// Marker stored in place of a value for failures that must not be retried.
    private record PermanentFailure (DatasetException exception) { }

}
