package io.ragweave.core.cache;

import io.ragweave.core.adapter.CacheAdapter;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/// Get-or-compute cache with per-key call coalescing over a {@link CacheAdapter}.
///
/// ### Flow
/// 1. A live entry in the backend is returned directly.
/// 2. Otherwise the caller claims the key by `putIfAbsent` of a future into the
///    in-flight map. Only the claiming caller (the leader) computes.
/// 3. The leader re-checks the backend, then runs the computation outside any
///    lock, stores the result with its TTL and completes the future.
/// 4. Concurrent callers for the same key wait on that future and receive the
///    same value or the same exception.
///
/// A failed computation deletes the key from the backend before the future is
/// completed, so the next caller recomputes.
///
/// @implNote Thread-safe. Contention is per key: callers for different keys never
/// wait on each other.
///
/// @see CacheKey for fingerprinting
/// @see CachingLlmAdapter for the decorator used by the built-in steps
public final class CacheLayer {

    private static final Logger logger = Logger.getLogger(CacheLayer.class.getName());

    private final CacheAdapter backend;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ConcurrentMap<String, CompletableFuture<Object>> inFlight =
            new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong coalesced = new AtomicLong();
    private final AtomicLong bypassed = new AtomicLong();

    public CacheLayer(CacheAdapter backend, Duration defaultTtl) {
        this(backend, defaultTtl, Clock.systemUTC());
    }

    /// Creates a cache layer.
    ///
    /// @param backend storage backend, not null
    /// @param defaultTtl TTL used when a caller does not pass one, not null, positive
    /// @param clock time source for entry creation, not null
    public CacheLayer(CacheAdapter backend, Duration defaultTtl, Clock clock) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
    }

    /// Returns the cached value for `key` with the default TTL, computing it on a miss.
    ///
    /// @see #getOrCompute(CacheKey, Duration, CachePolicy, Callable)
    public <T> T getOrCompute(CacheKey key, Callable<T> compute) throws Exception {
        return getOrCompute(key, defaultTtl, CachePolicy.USE, compute);
    }

    /// Returns the cached value for `key`, computing it at most once across
    /// concurrent callers.
    ///
    /// @param key fingerprint key, not null
    /// @param ttl lifetime of a newly computed entry, null for the default TTL
    /// @param policy {@link CachePolicy#BYPASS} to compute without touching the cache, not null
    /// @param compute computation run on a miss, not null
    /// @param <T> value type
    /// @return the cached or computed value, may be null if `compute` returned null
    /// @throws Exception the exception thrown by `compute`, rethrown unchanged to
    ///     the leader and every coalesced caller
    @SuppressWarnings("unchecked")
    public <T> T getOrCompute(CacheKey key, Duration ttl, CachePolicy policy, Callable<T> compute)
            throws Exception {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(compute, "compute must not be null");

        if (policy == CachePolicy.BYPASS) {
            bypassed.incrementAndGet();
            return compute.call();
        }

        String backendKey = key.value();
        Optional<CacheEntry> live = backend.get(backendKey);
        if (live.isPresent()) {
            hits.incrementAndGet();
            return (T) live.get().value();
        }

        CompletableFuture<Object> claim = new CompletableFuture<>();
        CompletableFuture<Object> existing = inFlight.putIfAbsent(backendKey, claim);
        if (existing != null) {
            coalesced.incrementAndGet();
            logger.fine("Coalescing onto in-flight computation for " + backendKey);
            return (T) await(existing);
        }

        try {
            Optional<CacheEntry> raced = backend.get(backendKey);
            if (raced.isPresent()) {
                hits.incrementAndGet();
                claim.complete(raced.get().value());
                return (T) raced.get().value();
            }

            misses.incrementAndGet();
            T value;
            try {
                value = compute.call();
            } catch (Exception | Error e) {
                claim.completeExceptionally(e);
                try {
                    backend.delete(backendKey);
                } catch (RuntimeException deleteFailure) {
                    e.addSuppressed(deleteFailure);
                }
                throw e;
            }

            Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
            backend.set(backendKey, new CacheEntry(value, clock.instant(), effectiveTtl), effectiveTtl);
            claim.complete(value);
            return value;
        } catch (Exception | Error e) {
            // Backend failures must release coalesced waiters too.
            claim.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(backendKey, claim);
        }
    }

    /// Removes the entry for the key. An in-flight computation is not affected.
    ///
    /// @param key fingerprint key, not null
    public void invalidate(CacheKey key) {
        Objects.requireNonNull(key, "key must not be null");
        backend.delete(key.value());
    }

    /// Returns the number of computations currently in flight.
    ///
    /// @return in-flight key count
    public int inFlightCount() {
        return inFlight.size();
    }

    /// Returns a snapshot of the hit, miss, coalesced and bypass counters.
    ///
    /// @return statistics, never null
    public CacheStats stats() {
        return new CacheStats(hits.get(), misses.get(), coalesced.get(), bypassed.get());
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    private static Object await(CompletableFuture<Object> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }
}
