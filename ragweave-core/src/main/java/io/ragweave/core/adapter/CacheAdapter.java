package io.ragweave.core.adapter;

import io.ragweave.core.cache.CacheEntry;
import java.time.Duration;
import java.util.Optional;

/// Capability contract for key/value caching.
///
/// The {@link io.ragweave.core.cache.CacheLayer} builds get-or-compute and call
/// coalescing on top of this contract; backends only store and expire entries.
///
/// @implNote Implementations must be thread-safe.
///
/// @see io.ragweave.core.adapter.memory.InMemoryCacheAdapter for the default backend
public interface CacheAdapter {

    /// Looks up a live entry.
    ///
    /// @param key fingerprint key, not null
    /// @return the entry if present and not expired, empty otherwise
    Optional<CacheEntry> get(String key);

    /// Stores an entry, replacing any previous one for the key.
    ///
    /// @param key fingerprint key, not null
    /// @param entry entry to store, not null
    /// @param ttl expiry horizon the backend should honour, not null
    void set(String key, CacheEntry entry, Duration ttl);

    /// Removes the entry for the key, if any.
    ///
    /// @param key fingerprint key, not null
    void delete(String key);
}
