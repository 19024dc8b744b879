package io.ragweave.core.cache;

/// Per-request caching behaviour.
public enum CachePolicy {

    /// Serve live entries, coalesce concurrent misses and store the computed value.
    USE,

    /// Skip the cache entirely: always compute, never read or write.
    BYPASS
}
