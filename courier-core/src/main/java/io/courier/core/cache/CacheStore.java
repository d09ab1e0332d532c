package io.courier.core.cache;

import io.courier.core.request.CachePriority;
import java.time.Duration;
import java.util.Optional;

/// Key/value store with expiring entries, consumed by the caching behavior.
///
/// ### Contracts
/// - **Postcondition**: {@link #get(String)} never returns an expired entry
/// - **Invariant**: values are never null
///
/// @see InMemoryCacheStore
/// @see io.courier.core.behavior.CachingBehavior
public interface CacheStore {

    /// Looks up a live entry.
    ///
    /// @param key the cache key, not null
    /// @return the stored value, or empty if absent or expired
    Optional<Object> get(String key);

    /// Stores a value, replacing any existing entry for the key.
    ///
    /// @param key the cache key, not null
    /// @param value the value, not null
    /// @param expiration time to live from now, positive
    /// @param priority retention hint for size-bounded stores, not null
    void set(String key, Object value, Duration expiration, CachePriority priority);

    /// Removes an entry.
    ///
    /// @param key the cache key, not null
    /// @return `true` if a live entry was removed
    boolean remove(String key);
}
