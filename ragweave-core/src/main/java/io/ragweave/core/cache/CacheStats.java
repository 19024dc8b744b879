package io.ragweave.core.cache;

/// Point-in-time counters of a {@link CacheLayer}.
///
/// @param hits requests served from a live entry
/// @param misses requests that ran the computation
/// @param coalesced requests that waited on another caller's in-flight computation
/// @param bypassed requests that opted out of the cache
public record CacheStats(long hits, long misses, long coalesced, long bypassed) {

    /// Returns the fraction of cache-eligible requests that avoided a computation.
    ///
    /// @return hit ratio in `[0, 1]`, 0 when no request was made
    public double hitRatio() {
        long total = hits + misses + coalesced;
        return total == 0 ? 0.0 : (double) (hits + coalesced) / total;
    }
}
