package io.courier.core.behavior;

import io.courier.core.cache.CacheStore;
import io.courier.core.dispatch.CancellationSignal;
import io.courier.core.pipeline.Continuation;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.CacheableRequest;
import io.courier.core.util.LogSanitizer;
import io.smallrye.mutiny.Uni;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// Serves {@link CacheableRequest}s from a {@link CacheStore}.
///
/// The store key is `{prefix}:{request class name}:{cacheKey}`, so equal keys of different
/// request types never collide. On a hit the cached value is returned and the
/// continuation is not called. On a miss the continuation runs and a non-null response is
/// stored with the request's expiration and priority. Handler failures are propagated and
/// never cached. A failing store read fails the request before the handler runs; a failing
/// store write is logged at WARN and the handler's response is still returned.
///
/// Register with bound `CacheableRequest.class`:
/// {@snippet :
/// registry.registerBehavior(CacheableRequest.class, new CachingBehavior<>(store));
/// }
///
/// @param <Q> the cacheable request type
/// @param <R> the response type
public class CachingBehavior<Q extends CacheableRequest<R>, R> implements PipelineBehavior<Q, R> {

    private static final Logger LOG = Logger.getLogger(CachingBehavior.class);

    /// Default namespace prepended to every key.
    public static final String DEFAULT_KEY_PREFIX = "Courier:Cache";

    private final CacheStore store;
    private final String keyPrefix;

    public CachingBehavior(CacheStore store) {
        this(store, DEFAULT_KEY_PREFIX);
    }

    /// Creates the behavior with a custom key namespace.
    ///
    /// @param store the cache store, not null
    /// @param keyPrefix namespace prepended to every key, not null
    public CachingBehavior(CacheStore store, String keyPrefix) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix must not be null");
    }

    @Override
    @SuppressWarnings("unchecked")
    public Uni<R> handle(Q request, Continuation<R> next, CancellationSignal signal) {
        return Uni.createFrom()
                .deferred(
                        () -> {
                            String key = cacheKey(request);
                            Optional<Object> cached = store.get(key);
                            if (cached.isPresent()) {
                                LOG.debugv("Cache hit: {0}", LogSanitizer.sanitize(key));
                                return Uni.createFrom().item((R) cached.get());
                            }
                            LOG.debugv("Cache miss: {0}", LogSanitizer.sanitize(key));
                            return next.proceed()
                                    .onItem()
                                    .invoke(response -> remember(key, request, response));
                        });
    }

    /// Builds the store key for a request.
    ///
    /// @param request the cacheable request, not null
    /// @return namespaced key, never null
    public String cacheKey(CacheableRequest<?> request) {
        return keyPrefix + ":" + request.getClass().getName() + ":" + request.cacheKey();
    }

    private void remember(String key, Q request, R response) {
        if (response == null) {
            return;
        }
        try {
            store.set(key, response, request.cacheExpiration(), request.cachePriority());
        } catch (RuntimeException e) {
            LOG.warnv(e, "Cache write failed: {0}", LogSanitizer.sanitize(key));
        }
    }
}
