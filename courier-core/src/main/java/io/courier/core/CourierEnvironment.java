package io.courier.core;

import io.courier.core.cache.CacheStore;
import io.courier.core.dispatch.Mediator;
import io.courier.core.handler.HandlerRegistry;
import io.courier.core.validation.ValidatorRegistry;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/// Container holding a ready {@link Mediator} and the components it was wired from.
///
/// Implements {@link AutoCloseable} so that a notification pool created by
/// {@link CourierFactory} is shut down with the environment. Executors supplied by the
/// caller are left running.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link CourierFactory.Builder} rather than direct
/// construction.
public final class CourierEnvironment implements AutoCloseable {

    private final Mediator mediator;
    private final HandlerRegistry handlerRegistry;
    private final ValidatorRegistry validatorRegistry;
    private final CacheStore cacheStore;
    private final ExecutorService ownedExecutor;

    /// Creates an environment.
    ///
    /// @param mediator the wired mediator, not null
    /// @param handlerRegistry the registry the mediator reads from, not null
    /// @param validatorRegistry validators used by the validation behavior, may be null
    /// @param cacheStore store used by the caching behavior, may be null
    /// @param ownedExecutor notification pool to shut down on {@link #close()}, may be null
    public CourierEnvironment(
            Mediator mediator,
            HandlerRegistry handlerRegistry,
            ValidatorRegistry validatorRegistry,
            CacheStore cacheStore,
            ExecutorService ownedExecutor) {
        this.mediator = mediator;
        this.handlerRegistry = handlerRegistry;
        this.validatorRegistry = validatorRegistry;
        this.cacheStore = cacheStore;
        this.ownedExecutor = ownedExecutor;
    }

    public Mediator getMediator() {
        return mediator;
    }

    public HandlerRegistry getHandlerRegistry() {
        return handlerRegistry;
    }

    public Optional<ValidatorRegistry> getValidatorRegistry() {
        return Optional.ofNullable(validatorRegistry);
    }

    public Optional<CacheStore> getCacheStore() {
        return Optional.ofNullable(cacheStore);
    }

    /// Shuts down the notification pool if the factory created one.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block. Handlers already
    /// running continue to completion.
    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }
}
