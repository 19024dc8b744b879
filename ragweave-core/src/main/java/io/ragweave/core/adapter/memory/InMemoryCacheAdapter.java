package io.ragweave.core.adapter.memory;

import io.ragweave.core.adapter.CacheAdapter;
import io.ragweave.core.cache.CacheEntry;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory cache backend (default implementation).
///
/// Thread-safe, no external dependencies. Expired entries are evicted lazily
/// on read; {@link #evictExpired()} sweeps the whole map.
///
/// @implNote Uses ConcurrentHashMap for thread-safety. Eviction uses
/// `remove(key, entry)` so a concurrent `set` of a fresh entry is never lost.
/// @see CacheAdapter for contract
public final class InMemoryCacheAdapter implements CacheAdapter {

    private final Map<String, CacheEntry> storage = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCacheAdapter() {
        this(Clock.systemUTC());
    }

    /// Creates a backend that reads time from the given clock.
    ///
    /// @param clock time source for expiry checks, not null
    public InMemoryCacheAdapter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        Objects.requireNonNull(key, "key must not be null");

        CacheEntry entry = storage.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            storage.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    @Override
    public void set(String key, CacheEntry entry, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(entry, "entry must not be null");

        storage.put(key, entry);
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key must not be null");

        storage.remove(key);
    }

    /// Removes every expired entry.
    ///
    /// @return number of entries evicted
    public int evictExpired() {
        var now = clock.instant();
        int before = storage.size();
        storage.entrySet().removeIf(e -> e.getValue().isExpired(now));
        return before - storage.size();
    }

    /// Returns the number of stored entries, including not-yet-evicted expired ones.
    ///
    /// @return entry count
    public int size() {
        return storage.size();
    }
}
