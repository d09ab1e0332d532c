package io.courier.core.request;

/// Retention hint passed to the cache store alongside a cached response.
///
/// Stores that bound their size evict lower priorities first. {@link #NEVER_REMOVE}
/// entries are only dropped when they expire.
public enum CachePriority {
    LOW,
    NORMAL,
    HIGH,
    NEVER_REMOVE
}
