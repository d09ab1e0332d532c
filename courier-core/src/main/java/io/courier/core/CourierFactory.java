package io.courier.core;

import io.courier.core.behavior.CachingBehavior;
import io.courier.core.behavior.PerformanceLoggingBehavior;
import io.courier.core.behavior.TimeoutBehavior;
import io.courier.core.behavior.ValidationBehavior;
import io.courier.core.cache.CacheStore;
import io.courier.core.dispatch.DefaultMediator;
import io.courier.core.dispatch.Mediator;
import io.courier.core.handler.DefaultHandlerRegistry;
import io.courier.core.handler.HandlerRegistry;
import io.courier.core.pipeline.PipelineBehavior;
import io.courier.core.request.BaseRequest;
import io.courier.core.request.CacheableRequest;
import io.courier.core.validation.ValidatorRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.jboss.logging.Logger;

/// Factory for wiring a {@link Mediator} together with the built-in behaviors.
///
/// Built-in behaviors are appended to the handler registry in a fixed order, after any
/// behavior the registry already holds:
/// 1. Performance logging, when enabled
/// 2. Timeout, when a request timeout is configured
/// 3. Validation, when enabled and a validator registry is supplied
/// 4. Caching (bound to {@link CacheableRequest}), when enabled and a cache store is supplied
/// 5. Behaviors added through {@link Builder#behavior(PipelineBehavior)}, in call order
///
/// ### Usage
/// {@snippet :
/// var registry = new DefaultHandlerRegistry();
/// registry.registerRequestHandler(
///         Echo.class, (request, signal) -> Uni.createFrom().item(request.text()));
///
/// try (var env = CourierFactory.builder()
///         .config(CourierConfig.builder().slowRequestThreshold(Duration.ofMillis(200)).build())
///         .handlerRegistry(registry)
///         .cacheStore(new InMemoryCacheStore())
///         .build()) {
///     String echoed = env.getMediator().send(new Echo("hi")).await().indefinitely();
/// }
/// }
///
/// @implNote Utility class with only static methods. Building registers behaviors on the
/// supplied registry, so a registry should be passed to one builder only.
///
/// @see CourierConfig
/// @see CourierEnvironment
public final class CourierFactory {

    private static final Logger LOG = Logger.getLogger(CourierFactory.class);

    private CourierFactory() {
        // Utility class - prevent instantiation
    }

    /// Wires a mediator over a registry with the default configuration.
    ///
    /// Only performance logging is registered, since no validator registry or cache store
    /// is supplied.
    ///
    /// @param registry populated handler registry, not null
    /// @return mediator, never null
    public static Mediator createMediator(HandlerRegistry registry) {
        return builder().handlerRegistry(registry).build().getMediator();
    }

    /// Creates a new builder for fluent environment configuration.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link CourierEnvironment} instances.
    public static class Builder {
        private CourierConfig config = new CourierConfig();
        private HandlerRegistry handlerRegistry;
        private ValidatorRegistry validatorRegistry;
        private CacheStore cacheStore;
        private Executor notificationExecutor;
        private final List<BehaviorEntry> behaviors = new ArrayList<>();

        private Builder() {}

        /// Sets the configuration.
        ///
        /// @param config configuration, not null
        /// @return this builder for chaining, never null
        public Builder config(CourierConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /// Sets the registry handlers are read from. A new {@link DefaultHandlerRegistry}
        /// is created when none is given.
        ///
        /// @param handlerRegistry the registry, not null
        /// @return this builder for chaining, never null
        public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
            this.handlerRegistry = handlerRegistry;
            return this;
        }

        public Builder validatorRegistry(ValidatorRegistry validatorRegistry) {
            this.validatorRegistry = validatorRegistry;
            return this;
        }

        public Builder cacheStore(CacheStore cacheStore) {
            this.cacheStore = cacheStore;
            return this;
        }

        /// Sets the executor notification handlers are subscribed on. Takes precedence over
        /// {@link CourierConfig#getNotificationPoolSize()}; the caller keeps ownership.
        ///
        /// @param executor the executor, not null
        /// @return this builder for chaining, never null
        public Builder notificationExecutor(Executor executor) {
            this.notificationExecutor = executor;
            return this;
        }

        /// Appends a behavior applied to every request.
        ///
        /// @param behavior the behavior, not null
        /// @return this builder for chaining, never null
        public Builder behavior(PipelineBehavior<?, ?> behavior) {
            return behavior(BaseRequest.class, behavior);
        }

        /// Appends a behavior applied to requests assignable to `requestBound`.
        ///
        /// @param requestBound most general accepted request type, not null
        /// @param behavior the behavior, not null
        /// @return this builder for chaining, never null
        public Builder behavior(
                Class<? extends BaseRequest> requestBound, PipelineBehavior<?, ?> behavior) {
            behaviors.add(
                    new BehaviorEntry(
                            Objects.requireNonNull(requestBound, "requestBound must not be null"),
                            Objects.requireNonNull(behavior, "behavior must not be null")));
            return this;
        }

        /// Builds the environment.
        ///
        /// @apiNote **Side effects**:
        /// - Appends behaviors to the handler registry
        /// - Creates a fixed thread pool when `notificationPoolSize` is positive and no
        ///   executor was supplied
        ///
        /// @return the configured environment, never null
        public CourierEnvironment build() {
            HandlerRegistry registry =
                    handlerRegistry != null ? handlerRegistry : new DefaultHandlerRegistry();

            if (config.isPerformanceLoggingEnabled()) {
                registry.registerBehavior(
                        new PerformanceLoggingBehavior<BaseRequest, Object>(
                                config.getSlowRequestThreshold()));
            }
            if (config.getRequestTimeout() != null) {
                registry.registerBehavior(
                        new TimeoutBehavior<BaseRequest, Object>(config.getRequestTimeout()));
            }
            if (config.isValidationEnabled() && validatorRegistry != null) {
                registry.registerBehavior(
                        new ValidationBehavior<BaseRequest, Object>(validatorRegistry));
            }
            if (config.isCachingEnabled() && cacheStore != null) {
                registry.registerBehavior(
                        CacheableRequest.class,
                        new CachingBehavior<CacheableRequest<Object>, Object>(
                                cacheStore, config.getCacheKeyPrefix()));
            }
            for (BehaviorEntry entry : behaviors) {
                registry.registerBehavior(entry.requestBound(), entry.behavior());
            }

            ExecutorService ownedExecutor = null;
            Executor executor = notificationExecutor;
            if (executor == null && config.getNotificationPoolSize() > 0) {
                ownedExecutor = Executors.newFixedThreadPool(config.getNotificationPoolSize());
                executor = ownedExecutor;
            }

            LOG.debugv(
                    "Courier environment built: validation={0}, caching={1}, pooled fan-out={2}",
                    config.isValidationEnabled() && validatorRegistry != null,
                    config.isCachingEnabled() && cacheStore != null,
                    executor != null);

            Mediator mediator = new DefaultMediator(registry, executor);
            return new CourierEnvironment(
                    mediator, registry, validatorRegistry, cacheStore, ownedExecutor);
        }
    }

    private record BehaviorEntry(
            Class<? extends BaseRequest> requestBound, PipelineBehavior<?, ?> behavior) {}
}
