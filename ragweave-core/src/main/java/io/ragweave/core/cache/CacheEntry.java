package io.ragweave.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Immutable cached value with its creation time and time-to-live.
///
/// Entries are never updated in place. An expired entry is evicted and a new
/// one is created by the next computation.
///
/// @param value the cached value, may be null if the computation returned null
/// @param createdAt when the value was computed, not null
/// @param ttl how long the value stays live, not null, positive
public record CacheEntry(Object value, Instant createdAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
    }

    /// Returns the instant after which the entry is no longer served.
    ///
    /// @return expiry instant, never null
    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    /// Checks whether the entry has expired at the given instant.
    ///
    /// @param now the current time, not null
    /// @return true if `now` is at or past {@link #expiresAt()}
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
