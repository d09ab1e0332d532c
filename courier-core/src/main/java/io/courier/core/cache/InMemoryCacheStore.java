package io.courier.core.cache;

import io.courier.core.request.CachePriority;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/// Process-local {@link CacheStore} backed by a {@link ConcurrentHashMap}.
///
/// Entries carry an absolute expiry computed from the injected {@link Clock}; expired
/// entries are removed lazily when read. When a capacity is set and a write pushes the
/// store beyond it, entries are evicted lowest priority first, then earliest expiry first.
/// {@link CachePriority#NEVER_REMOVE} entries are never evicted for capacity, only on
/// expiry.
///
/// @implNote Thread-safe. Capacity enforcement is best effort under concurrent writes.
public class InMemoryCacheStore implements CacheStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCacheStore.class);

    /// Capacity value meaning "no limit".
    public static final int UNBOUNDED = 0;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int capacity;

    /// Creates an unbounded store using the system clock.
    public InMemoryCacheStore() {
        this(Clock.systemUTC(), UNBOUNDED);
    }

    /// Creates a store.
    ///
    /// @param clock source of the current time, not null
    /// @param capacity maximum number of entries, or {@link #UNBOUNDED}
    public InMemoryCacheStore(Clock clock, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.capacity = capacity;
    }

    @Override
    public Optional<Object> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, Object value, Duration expiration, CachePriority priority) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(expiration, "expiration must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        if (expiration.isNegative() || expiration.isZero()) {
            throw new IllegalArgumentException("expiration must be positive: " + expiration);
        }
        entries.put(key, new Entry(value, clock.instant().plus(expiration), priority));
        if (capacity != UNBOUNDED && entries.size() > capacity) {
            evict();
        }
    }

    @Override
    public boolean remove(String key) {
        Objects.requireNonNull(key, "key must not be null");
        Entry removed = entries.remove(key);
        return removed != null && !removed.isExpired(clock.instant());
    }

    /// Removes every entry.
    public void clear() {
        entries.clear();
    }

    /// Returns the number of stored entries, including expired ones not yet purged.
    ///
    /// @return entry count
    public int size() {
        return entries.size();
    }

    private void evict() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        while (entries.size() > capacity) {
            Optional<Map.Entry<String, Entry>> victim =
                    entries.entrySet().stream()
                            .filter(e -> e.getValue().priority() != CachePriority.NEVER_REMOVE)
                            .min(
                                    Comparator.comparing(
                                                    (Map.Entry<String, Entry> e) ->
                                                            e.getValue().priority())
                                            .thenComparing(e -> e.getValue().expiresAt()));
            if (victim.isEmpty()) {
                return;
            }
            entries.remove(victim.get().getKey(), victim.get().getValue());
            LOG.tracev("Evicted cache entry with priority {0}", victim.get().getValue().priority());
        }
    }

    private record Entry(Object value, Instant expiresAt, CachePriority priority) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
