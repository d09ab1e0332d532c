package io.courier.core.request;

import java.time.Duration;

/// A query whose response may be served from a cache.
///
/// The caching behavior scopes {@link #cacheKey()} by the concrete request class, so two
/// different request types may safely use the same key.
///
/// ### Contracts
/// - **Precondition**: {@link #cacheKey()} is non-null and stable for equal requests
/// - **Precondition**: {@link #cacheExpiration()} is positive
///
/// @param <R> the response type
/// @see io.courier.core.behavior.CachingBehavior
public interface CacheableRequest<R> extends Request<R> {

    /// Returns the key identifying this request's response within its request type.
    ///
    /// @return cache key, not null
    String cacheKey();

    /// Returns how long a cached response stays valid.
    ///
    /// @return time to live, not null
    Duration cacheExpiration();

    /// Returns the retention hint for the cached response.
    ///
    /// @return priority, defaults to {@link CachePriority#NORMAL}
    default CachePriority cachePriority() {
        return CachePriority.NORMAL;
    }
}
